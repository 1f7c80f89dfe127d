package com.roundtrip.server.service;

import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.entity.Trip;
import com.roundtrip.pojo.vo.ScheduleResultVO;

import java.time.LocalDate;

/**
 * 行程编辑服务：每个编辑操作都会在修改站点列表后对整条行程做一次全量重算。
 * 服务本身无状态，行程由调用方携带并负责保存。
 */
public interface ItineraryService {

    /**
     * 全量重算。起始日期优先级：explicitStartDate -> trip.startDate -> 配置默认值。
     */
    ScheduleResultVO recalculate(Trip trip, LocalDate explicitStartDate);

    /**
     * 修改停留天数；锁定站点不允许修改。
     */
    ScheduleResultVO changeDuration(Trip trip, String stopId, Integer durationDays);

    /**
     * 切换锁定：锁定时以当前日期作为锁定日期，解锁时清空锁定日期。
     */
    ScheduleResultVO toggleLock(Trip trip, String stopId);

    /**
     * 编辑锁定站点的到达/离开日期（可只传一个），两者齐全时按区间反推停留天数。
     */
    ScheduleResultVO updateLockedDates(Trip trip, String stopId, LocalDate lockedArrivalDate,
                                       LocalDate lockedDepartureDate);

    /**
     * 新增站点，insertAfterId 为空时追加到末尾。
     */
    ScheduleResultVO addStop(Trip trip, Stop stop, String insertAfterId);

    ScheduleResultVO removeStop(Trip trip, String stopId);

    /**
     * 拖拽排序：把站点放到目标站点所在的位置。
     */
    ScheduleResultVO moveStop(Trip trip, String stopId, String targetStopId);
}
