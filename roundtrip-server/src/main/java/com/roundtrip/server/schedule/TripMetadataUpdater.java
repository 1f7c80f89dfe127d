package com.roundtrip.server.schedule;

import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.entity.Trip;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * 根据首末站回填行程的起止日期，仅供摘要/导出展示；
 * 回填的 startDate 会作为下一次重算时“已保存的起始日期”。
 */
@Component
public class TripMetadataUpdater {

    public void update(Trip trip) {
        List<Stop> stops = trip.getStops();
        if (stops == null || stops.isEmpty()) {
            return;
        }
        Stop first = stops.get(0);
        Stop last = stops.get(stops.size() - 1);

        LocalDate start = first.getArrivalDate() != null ? first.getArrivalDate() : first.getDepartureDate();
        LocalDate end = last.getDepartureDate() != null ? last.getDepartureDate() : last.getArrivalDate();
        if (start != null) {
            trip.setStartDate(start);
        }
        if (end != null) {
            trip.setEndDate(end);
        }
    }
}
