package com.roundtrip.server.convert;

import com.roundtrip.common.utils.DateUtil;
import com.roundtrip.pojo.dto.ItineraryDTO;
import com.roundtrip.pojo.dto.StopDTO;
import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.entity.Trip;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 请求 DTO -> 实体。日期字符串宽松解析：格式不合法视为缺失，由排期引擎按兜底规则处理。
 */
@Component
public class ItineraryConverter {

    public Trip toTrip(ItineraryDTO dto) {
        Trip trip = new Trip();
        trip.setTitle(dto.getTitle());
        trip.setStartDate(DateUtil.parseDate(dto.getStartDate()));
        trip.setStartDateLocked(dto.getStartDateLocked());
        trip.setEndDateLocked(dto.getEndDateLocked());

        List<Stop> stops = new ArrayList<>();
        if (dto.getStops() != null) {
            for (StopDTO stopDTO : dto.getStops()) {
                if (stopDTO != null) {
                    stops.add(toStop(stopDTO));
                }
            }
        }
        trip.setStops(stops);
        return trip;
    }

    public Stop toStop(StopDTO dto) {
        Stop stop = new Stop();
        stop.setId(dto.getId());
        stop.setName(dto.getName());
        stop.setDurationDays(dto.getDurationDays());
        stop.setArrivalDate(DateUtil.parseDate(dto.getArrivalDate()));
        stop.setDepartureDate(DateUtil.parseDate(dto.getDepartureDate()));
        stop.setIsDateLocked(dto.getIsDateLocked());
        stop.setLockedArrivalDate(DateUtil.parseDate(dto.getLockedArrivalDate()));
        stop.setLockedDepartureDate(DateUtil.parseDate(dto.getLockedDepartureDate()));
        return stop;
    }
}
