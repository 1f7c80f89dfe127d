package com.roundtrip.server.service.impl;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.common.exception.BaseException;
import com.roundtrip.common.properties.ItineraryProperties;
import com.roundtrip.common.result.ErrorCode;
import com.roundtrip.common.utils.DateUtil;
import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.entity.Trip;
import com.roundtrip.pojo.vo.ScheduleResultVO;
import com.roundtrip.server.schedule.ScheduleEngine;
import com.roundtrip.server.schedule.StopRules;
import com.roundtrip.server.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ItineraryServiceImpl implements ItineraryService {

    private final ScheduleEngine scheduleEngine;
    private final ItineraryProperties itineraryProperties;

    @Override
    public ScheduleResultVO recalculate(Trip trip, LocalDate explicitStartDate) {
        return scheduleEngine.recalculate(trip, resolveStartDate(trip, explicitStartDate));
    }

    @Override
    public ScheduleResultVO changeDuration(Trip trip, String stopId, Integer durationDays) {
        Stop stop = stops(trip).get(indexOf(trip, stopId));
        if (StopRules.isLocked(stop)) {
            log.warn("站点已锁定，拒绝修改停留天数: stopId={}", stopId);
            throw new BaseException(ErrorCode.STOP_DATE_LOCKED);
        }
        int days = (durationDays == null || durationDays < 1)
                ? ItineraryConstants.FALLBACK_DURATION_DAYS : durationDays;
        stop.setDurationDays(days);
        log.info("修改停留天数: stopId={}, durationDays={}", stopId, days);
        return recalculate(trip, null);
    }

    @Override
    public ScheduleResultVO toggleLock(Trip trip, String stopId) {
        Stop stop = stops(trip).get(indexOf(trip, stopId));
        boolean locking = !StopRules.isLocked(stop);
        stop.setIsDateLocked(locking);
        if (locking) {
            stop.setLockedArrivalDate(stop.getArrivalDate());
            stop.setLockedDepartureDate(stop.getDepartureDate());
        } else {
            stop.setLockedArrivalDate(null);
            stop.setLockedDepartureDate(null);
        }
        log.info("切换站点锁定: stopId={}, locked={}, arrival={}, departure={}",
                stopId, locking, stop.getArrivalDate(), stop.getDepartureDate());
        return recalculate(trip, null);
    }

    @Override
    public ScheduleResultVO updateLockedDates(Trip trip, String stopId, LocalDate lockedArrivalDate,
                                              LocalDate lockedDepartureDate) {
        Stop stop = stops(trip).get(indexOf(trip, stopId));
        if (!StopRules.isLocked(stop)) {
            throw new BaseException(ErrorCode.STOP_NOT_LOCKED);
        }
        if (lockedArrivalDate != null) {
            stop.setLockedArrivalDate(lockedArrivalDate);
            stop.setArrivalDate(lockedArrivalDate);
        }
        if (lockedDepartureDate != null) {
            stop.setLockedDepartureDate(lockedDepartureDate);
            stop.setDepartureDate(lockedDepartureDate);
        }
        // 锁定区间由用户决定，停留天数跟随区间，而不是反过来
        if (stop.getLockedArrivalDate() != null && stop.getLockedDepartureDate() != null) {
            long span = DateUtil.daysBetween(stop.getLockedArrivalDate(), stop.getLockedDepartureDate()) + 1;
            stop.setDurationDays((int) Math.min(Integer.MAX_VALUE, Math.max(1L, span)));
        }
        log.info("编辑锁定日期: stopId={}, lockedArrival={}, lockedDeparture={}, durationDays={}",
                stopId, stop.getLockedArrivalDate(), stop.getLockedDepartureDate(), stop.getDurationDays());
        return recalculate(trip, null);
    }

    @Override
    public ScheduleResultVO addStop(Trip trip, Stop stop, String insertAfterId) {
        if (stop == null) {
            throw new BaseException(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        List<Stop> stops = stops(trip);
        if (!StringUtils.hasText(stop.getId())) {
            stop.setId(UUID.randomUUID().toString());
        } else if (findIndex(stops, stop.getId()) >= 0) {
            throw new BaseException(ErrorCode.DUPLICATE_STOP_ID);
        }
        if (stop.getDurationDays() == null || stop.getDurationDays() < 1) {
            stop.setDurationDays(Math.max(1, itineraryProperties.getDefaultDurationDays()));
        }
        // 新站点一律未锁定、无日期，由重算填写
        stop.setIsDateLocked(false);
        stop.setLockedArrivalDate(null);
        stop.setLockedDepartureDate(null);
        stop.setArrivalDate(null);
        stop.setDepartureDate(null);

        int insertIndex = StringUtils.hasText(insertAfterId) ? indexOf(trip, insertAfterId) + 1 : stops.size();
        stops.add(insertIndex, stop);
        log.info("新增站点: stopId={}, name={}, index={}, durationDays={}",
                stop.getId(), stop.getName(), insertIndex, stop.getDurationDays());
        return recalculate(trip, null);
    }

    @Override
    public ScheduleResultVO removeStop(Trip trip, String stopId) {
        int index = indexOf(trip, stopId);
        List<Stop> stops = stops(trip);
        if (stops.size() <= 1) {
            throw new BaseException(ErrorCode.LAST_STOP_REMOVAL);
        }
        stops.remove(index);
        log.info("删除站点: stopId={}, remaining={}", stopId, stops.size());
        return recalculate(trip, null);
    }

    @Override
    public ScheduleResultVO moveStop(Trip trip, String stopId, String targetStopId) {
        int from = indexOf(trip, stopId);
        int target = indexOf(trip, targetStopId);
        if (from != target) {
            List<Stop> stops = stops(trip);
            Stop moved = stops.remove(from);
            // 向后拖动时，移除自身后目标位置前移一位
            int insertIndex = from < target ? target - 1 : target;
            stops.add(insertIndex, moved);
            log.info("站点排序: stopId={}, from={}, to={}", stopId, from, insertIndex);
        }
        return recalculate(trip, null);
    }

    private LocalDate resolveStartDate(Trip trip, LocalDate explicitStartDate) {
        if (explicitStartDate != null) {
            return explicitStartDate;
        }
        if (trip.getStartDate() != null) {
            return trip.getStartDate();
        }
        return DateUtil.parseDate(itineraryProperties.getDefaultStartDate());
    }

    private List<Stop> stops(Trip trip) {
        if (trip.getStops() == null) {
            trip.setStops(new ArrayList<>());
        }
        return trip.getStops();
    }

    private int indexOf(Trip trip, String stopId) {
        int index = findIndex(stops(trip), stopId);
        if (index < 0) {
            throw new BaseException(ErrorCode.STOP_NOT_FOUND, "站点不存在: " + stopId);
        }
        return index;
    }

    private static int findIndex(List<Stop> stops, String stopId) {
        if (stopId == null) {
            return -1;
        }
        for (int i = 0; i < stops.size(); i++) {
            if (Objects.equals(stops.get(i).getId(), stopId)) {
                return i;
            }
        }
        return -1;
    }
}
