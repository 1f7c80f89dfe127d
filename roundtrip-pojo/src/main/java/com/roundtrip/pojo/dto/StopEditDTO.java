package com.roundtrip.pojo.dto;

import lombok.Data;

/**
 * 针对单个站点的编辑请求：修改天数、切换锁定、编辑锁定日期、删除。
 * 各接口只读取自己需要的字段。
 */
@Data
public class StopEditDTO {

    private ItineraryDTO itinerary;

    private String stopId;

    /** 修改停留天数时使用 */
    private Integer durationDays;

    /** 编辑锁定日期时使用，可只传其中一个 */
    private String lockedArrivalDate;

    private String lockedDepartureDate;
}
