package com.roundtrip.pojo.vo;

import com.roundtrip.pojo.entity.Trip;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次排期重算的返回结果。
 * Result of a full itinerary recalculation.
 */
@Data
public class ScheduleResultVO {

    /** 回填日期后的行程（站点就地修改） */
    private Trip trip;

    private List<DateConflictVO> conflicts = new ArrayList<>();

    /**
     * 降级提示，例如“站点已锁定但缺少锁定日期，本次按未锁定处理”，
     * 与 conflicts 分开，方便前端区分展示。
     */
    private List<String> warnings = new ArrayList<>();

    /**
     * false 表示缺少起始日期、本次未重算，站点日期保持原样。
     */
    private boolean recalculated;
}
