package com.roundtrip.server.schedule;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.entity.Trip;
import com.roundtrip.pojo.vo.DateConflictVO;
import com.roundtrip.pojo.vo.ScheduleResultVO;
import com.roundtrip.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 行程排期引擎入口：锚点解析 -> 分段排期 -> 冲突检测 -> 回填行程起止日期。
 *
 * 说明：
 * - 每次都对整条站点列表全量重算，不做增量修补；
 * - 纯内存计算、无共享状态，可以被连续、快速地重复调用，结果幂等；
 * - 对任何输入都不抛异常，缺失的数据按兜底规则降级。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleEngine {

    private final AnchorResolver anchorResolver;
    private final SegmentScheduler segmentScheduler;
    private final ConflictDetector conflictDetector;
    private final TripMetadataUpdater tripMetadataUpdater;
    private final MetricsRecorder metricsRecorder;

    /**
     * 以 startDate 为起点重算整条行程。
     *
     * @param startDate 已按“请求指定 -> 行程已保存 -> 配置默认”解析好的起始日期；
     *                  为 null 时跳过重算，站点日期保持不变，只返回当前日期下的冲突
     */
    public ScheduleResultVO recalculate(Trip trip, LocalDate startDate) {
        if (trip.getStops() == null) {
            trip.setStops(new ArrayList<>());
        }
        List<Stop> stops = trip.getStops();

        ScheduleResultVO result = new ScheduleResultVO();
        result.setTrip(trip);
        if (stops.isEmpty()) {
            result.setRecalculated(true);
            return result;
        }

        if (startDate == null) {
            log.warn("缺少行程起始日期且无默认值，跳过重算: stops={}", stops.size());
            metricsRecorder.recordRecalculation(ItineraryConstants.MODE_SKIPPED);
            result.setRecalculated(false);
            result.setConflicts(conflictDetector.detect(stops));
            return result;
        }

        boolean startDateLocked = Boolean.TRUE.equals(trip.getStartDateLocked());
        AnchorResolver.Resolution resolution = anchorResolver.resolve(stops, startDate, startDateLocked);
        for (Stop degraded : resolution.getDegradedStops()) {
            result.getWarnings().add("站点「" + StopRules.labelOf(degraded)
                    + "」已锁定但缺少锁定日期，本次按未锁定处理");
            metricsRecorder.recordDegradedLock();
        }

        String mode = segmentScheduler.schedule(stops, resolution.getAnchors(), startDate);
        tripMetadataUpdater.update(trip);

        List<DateConflictVO> conflicts = conflictDetector.detect(stops);
        metricsRecorder.recordRecalculation(mode);
        metricsRecorder.recordConflicts(conflicts);
        log.debug("行程重算完成: mode={}, stops={}, anchors={}, conflicts={}",
                mode, stops.size(), resolution.getAnchors().size(), conflicts.size());

        result.setRecalculated(true);
        result.setConflicts(conflicts);
        return result;
    }
}
