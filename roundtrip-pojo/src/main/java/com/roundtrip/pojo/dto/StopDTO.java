package com.roundtrip.pojo.dto;

import lombok.Data;

/**
 * 站点请求体。日期为 YYYY-MM-DD 字符串，格式不合法时按缺失处理。
 */
@Data
public class StopDTO {
    private String id;
    private String name;
    private Integer durationDays;
    private String arrivalDate;
    private String departureDate;
    private Boolean isDateLocked;
    private String lockedArrivalDate;
    private String lockedDepartureDate;
}
