package com.roundtrip.pojo.entity;

import lombok.Data;

import java.time.LocalDate;

/**
 * 行程中的一个目的地（站点）。
 * <p>锁定不是子类型，而是同一个站点上的标记位 + 可选的锁定日期：
 * 站点在生命周期内可以反复锁定/解锁。</p>
 */
@Data
public class Stop {

    private String id;

    private String name;

    /**
     * 停留天数，缺失或非正数时按 1 天处理。
     */
    private Integer durationDays;

    private LocalDate arrivalDate;

    private LocalDate departureDate;

    /**
     * 为 true 时锁定日期为准，并镜像到 arrivalDate/departureDate。
     */
    private Boolean isDateLocked;

    private LocalDate lockedArrivalDate;

    private LocalDate lockedDepartureDate;
}
