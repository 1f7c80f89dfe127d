package com.roundtrip.server.schedule;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.common.utils.DateUtil;
import com.roundtrip.pojo.entity.Stop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * 分段顺推排期：在相邻两个锚点之间，为未锁定站点依次填写到达/离开日期。
 *
 * 每段的游标都从该段起点锚点重新开始（起点锚点用 startDate，锁定站点用其离开日期 + 1），
 * 所以一个锁定站点上游的天数变化不会越过它影响下游。
 */
@Component
@Slf4j
public class SegmentScheduler {

    /**
     * 就地修改站点日期，返回本次使用的排期模式。
     *
     * @param anchors 已按位置升序排列，第一个为行程起点锚点
     */
    public String schedule(List<Stop> stops, List<Anchor> anchors, LocalDate startDate) {
        Anchor tripStart = anchors.get(0);
        if (anchors.size() == 1 && !tripStart.isLocked()) {
            forwardFill(stops, 0, stops.size(), startDate);
            return ItineraryConstants.MODE_SIMPLE;
        }

        for (int a = 0; a < anchors.size(); a++) {
            Anchor segmentStart = anchors.get(a);
            int position = segmentStart.getPosition();
            int endExclusive = a + 1 < anchors.size() ? anchors.get(a + 1).getPosition() : stops.size();

            LocalDate seed;
            if (position == ItineraryConstants.TRIP_START_POSITION) {
                seed = startDate;
            } else {
                Stop anchorStop = stops.get(position);
                anchorStop.setArrivalDate(segmentStart.getArrivalDate());
                anchorStop.setDepartureDate(segmentStart.getDepartureDate());
                seed = DateUtil.addDays(segmentStart.getDepartureDate(), 1);
            }

            if (position + 1 >= endExclusive) {
                continue;
            }
            forwardFill(stops, position + 1, endExclusive, seed);
        }
        log.debug("分段排期完成: anchors={}, stops={}", anchors.size(), stops.size());
        return ItineraryConstants.MODE_SEGMENTED;
    }

    private void forwardFill(List<Stop> stops, int fromInclusive, int toExclusive, LocalDate seed) {
        LocalDate cursor = seed;
        for (int i = fromInclusive; i < toExclusive; i++) {
            Stop stop = stops.get(i);
            LocalDate departure = DateUtil.addDays(cursor, StopRules.durationOf(stop) - 1L);
            stop.setArrivalDate(cursor);
            stop.setDepartureDate(departure);
            cursor = DateUtil.addDays(departure, 1);
        }
    }
}
