package com.roundtrip.common.constant;

public class ItineraryConstants {

    private ItineraryConstants() {
    }

    /** 虚拟的“行程起点”锚点位置，排在所有站点之前 */
    public static final int TRIP_START_POSITION = -1;

    /** 停留天数缺失或非正数时的兜底值 */
    public static final int FALLBACK_DURATION_DAYS = 1;

    /** 排期模式：无锁定时的单次顺推 */
    public static final String MODE_SIMPLE = "simple";

    /** 排期模式：按锚点分段顺推 */
    public static final String MODE_SEGMENTED = "segmented";

    /** 排期模式：缺少起始日期，跳过本次重算 */
    public static final String MODE_SKIPPED = "skipped";
}
