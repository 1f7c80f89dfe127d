package com.roundtrip.server.metrics;

import com.roundtrip.pojo.vo.DateConflictVO;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录基础 Counter 指标，可通过 /actuator/metrics 查看；
 * - 指标记录失败只打 debug 日志，不影响排期结果。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录一次行程重算。
     *
     * @param mode simple / segmented / skipped
     */
    public void recordRecalculation(String mode) {
        try {
            meterRegistry.counter("roundtrip.itinerary.recalculate", "mode", safe(mode)).increment();
        } catch (Exception e) {
            log.debug("记录重算指标失败: {}", e.getMessage());
        }
    }

    /**
     * 按类型累计本次检测出的冲突数量。
     */
    public void recordConflicts(List<DateConflictVO> conflicts) {
        if (conflicts == null || conflicts.isEmpty()) {
            return;
        }
        try {
            for (DateConflictVO conflict : conflicts) {
                String type = conflict.getType() == null ? null : conflict.getType().getCode();
                meterRegistry.counter("roundtrip.itinerary.conflict", "type", safe(type)).increment();
            }
        } catch (Exception e) {
            log.debug("记录冲突指标失败: {}", e.getMessage());
        }
    }

    public void recordDegradedLock() {
        try {
            meterRegistry.counter("roundtrip.itinerary.lock.degraded").increment();
        } catch (Exception e) {
            log.debug("记录锁定降级指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
