package com.roundtrip.server.metrics;

import com.roundtrip.pojo.enums.ConflictType;
import com.roundtrip.pojo.vo.DateConflictVO;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MetricsRecorderTest {

    @Test
    void shouldCountRecalculationsAndConflictsByTag() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsRecorder recorder = new MetricsRecorder(registry);

        recorder.recordRecalculation("segmented");
        recorder.recordRecalculation(null);
        recorder.recordConflicts(List.of(
                new DateConflictVO(ConflictType.GAP, "a", "b", 2L, "gap"),
                new DateConflictVO(ConflictType.GAP, "b", "c", 1L, "gap"),
                new DateConflictVO(ConflictType.DURATION_EXCEEDED, null, null, 3L, "exceeded")));

        assertEquals(1.0, registry.counter("roundtrip.itinerary.recalculate", "mode", "segmented").count());
        assertEquals(1.0, registry.counter("roundtrip.itinerary.recalculate", "mode", "unknown").count());
        assertEquals(2.0, registry.counter("roundtrip.itinerary.conflict", "type", "gap").count());
        assertEquals(1.0, registry.counter("roundtrip.itinerary.conflict", "type", "duration_exceeded").count());
    }

    @Test
    void registryFailureShouldNotPropagate() {
        MeterRegistry registry = mock(MeterRegistry.class);
        when(registry.counter(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("down"));
        MetricsRecorder recorder = new MetricsRecorder(registry);

        assertDoesNotThrow(() -> recorder.recordRecalculation("simple"));
    }
}
