package com.roundtrip.server.schedule;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.pojo.entity.Stop;
import org.springframework.util.StringUtils;

/**
 * 读取站点字段时的统一兜底规则。
 */
public final class StopRules {

    private StopRules() {
    }

    /**
     * 有效停留天数：缺失或非正数按 1 天。
     */
    public static int durationOf(Stop stop) {
        Integer days = stop.getDurationDays();
        if (days == null || days < 1) {
            return ItineraryConstants.FALLBACK_DURATION_DAYS;
        }
        return days;
    }

    public static boolean isLocked(Stop stop) {
        return Boolean.TRUE.equals(stop.getIsDateLocked());
    }

    /**
     * 提示文案中使用的站点名称，没有名称时退回 id。
     */
    public static String labelOf(Stop stop) {
        return StringUtils.hasText(stop.getName()) ? stop.getName() : String.valueOf(stop.getId());
    }
}
