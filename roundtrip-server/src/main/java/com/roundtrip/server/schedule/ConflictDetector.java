package com.roundtrip.server.schedule;

import com.roundtrip.common.utils.DateUtil;
import com.roundtrip.pojo.entity.Stop;
import com.roundtrip.pojo.enums.ConflictType;
import com.roundtrip.pojo.vo.DateConflictVO;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 冲突检测：只读站点日期，不修改任何站点。冲突只做提示，不阻断排期。
 *
 * 两类检查互相独立：
 * - 相邻两站：离开日到下一站到达日应正好相差 1 天，小于 1 为重叠，大于 1 为空档；
 * - 首末锁定站之间：区间内总停留天数不能超过两者日期之间的可用天数。
 */
@Component
public class ConflictDetector {

    public List<DateConflictVO> detect(List<Stop> stops) {
        List<DateConflictVO> conflicts = new ArrayList<>();
        detectAdjacent(stops, conflicts);
        detectLockedWindowOverrun(stops, conflicts);
        return conflicts;
    }

    private void detectAdjacent(List<Stop> stops, List<DateConflictVO> conflicts) {
        for (int i = 0; i + 1 < stops.size(); i++) {
            Stop current = stops.get(i);
            Stop next = stops.get(i + 1);
            if (current.getDepartureDate() == null || next.getArrivalDate() == null) {
                continue;
            }
            long daysDiff = DateUtil.daysBetween(current.getDepartureDate(), next.getArrivalDate());
            String route = StopRules.labelOf(current) + " → " + StopRules.labelOf(next);
            if (daysDiff < 1) {
                long days = Math.abs(daysDiff - 1);
                conflicts.add(new DateConflictVO(ConflictType.OVERLAP, current.getId(), next.getId(), days,
                        route + ": " + days + " day(s) overlap"));
            } else if (daysDiff > 1) {
                long days = daysDiff - 1;
                conflicts.add(new DateConflictVO(ConflictType.GAP, current.getId(), next.getId(), days,
                        route + ": " + days + " day(s) gap"));
            }
        }
    }

    private void detectLockedWindowOverrun(List<Stop> stops, List<DateConflictVO> conflicts) {
        int firstLocked = -1;
        int lastLocked = -1;
        for (int i = 0; i < stops.size(); i++) {
            if (StopRules.isLocked(stops.get(i))) {
                if (firstLocked < 0) {
                    firstLocked = i;
                }
                lastLocked = i;
            }
        }
        if (firstLocked < 0 || firstLocked == lastLocked) {
            return;
        }

        LocalDate windowStart = stops.get(firstLocked).getArrivalDate();
        LocalDate windowEnd = stops.get(lastLocked).getDepartureDate();
        if (windowStart == null || windowEnd == null) {
            return;
        }
        long availableDays = DateUtil.daysBetween(windowStart, windowEnd) + 1;
        long totalDuration = 0;
        for (int i = firstLocked; i <= lastLocked; i++) {
            totalDuration += StopRules.durationOf(stops.get(i));
        }
        if (totalDuration > availableDays) {
            long days = totalDuration - availableDays;
            conflicts.add(new DateConflictVO(ConflictType.DURATION_EXCEEDED, null, null, days,
                    "Total itinerary exceeds available time by " + days + " day(s)"));
        }
    }
}
