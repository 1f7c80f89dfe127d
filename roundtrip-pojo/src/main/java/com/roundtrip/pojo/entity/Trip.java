package com.roundtrip.pojo.entity;

import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class Trip {

    private String title;

    /**
     * 行程起始日期：首站未锁定时，排期从这一天开始顺推。
     */
    private LocalDate startDate;

    /**
     * 由排期结果回填（末站离开日期），仅用于展示/导出。
     */
    private LocalDate endDate;

    private Boolean startDateLocked;

    /**
     * 行程结束边界是否固定；目前只透传，不参与排期计算。
     */
    private Boolean endDateLocked;

    private List<Stop> stops = new ArrayList<>();
}
