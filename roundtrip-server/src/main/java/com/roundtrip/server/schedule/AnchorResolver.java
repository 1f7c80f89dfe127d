package com.roundtrip.server.schedule;

import com.roundtrip.common.constant.ItineraryConstants;
import com.roundtrip.pojo.entity.Stop;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 锚点解析：行程起点 + 每个锁定站点，按位置升序排列。
 *
 * 锁定站点优先取 lockedArrivalDate/lockedDepartureDate，未设置时退回当前的
 * arrivalDate/departureDate；凑不齐一对日期（包括锁定字段只填了一半）的站点本次按未锁定处理（降级，不报错）。
 */
@Component
@Slf4j
public class AnchorResolver {

    public Resolution resolve(List<Stop> stops, LocalDate startDate, boolean startDateLocked) {
        Resolution resolution = new Resolution();
        resolution.getAnchors().add(
                new Anchor(ItineraryConstants.TRIP_START_POSITION, startDate, null, startDateLocked));

        for (int i = 0; i < stops.size(); i++) {
            Stop stop = stops.get(i);
            if (!StopRules.isLocked(stop)) {
                continue;
            }
            Anchor anchor = anchorOf(i, stop);
            if (anchor == null) {
                log.warn("锁定站点缺少完整日期，本次按未锁定处理: stopId={}, index={}, lockedArrival={}, lockedDeparture={}",
                        stop.getId(), i, stop.getLockedArrivalDate(), stop.getLockedDepartureDate());
                resolution.getDegradedStops().add(stop);
                continue;
            }
            resolution.getAnchors().add(anchor);
        }
        return resolution;
    }

    /**
     * 到达/离开日期按整对取值，不逐个字段拼接：
     * 锁定字段两个都有时用锁定字段；两个都没有时退回当前日期（也必须成对）；
     * 只填了一半的锁定字段视为无效，返回 null。
     */
    private static Anchor anchorOf(int position, Stop stop) {
        LocalDate lockedArrival = stop.getLockedArrivalDate();
        LocalDate lockedDeparture = stop.getLockedDepartureDate();
        if (lockedArrival != null && lockedDeparture != null) {
            return new Anchor(position, lockedArrival, lockedDeparture, true);
        }
        if (lockedArrival == null && lockedDeparture == null
                && stop.getArrivalDate() != null && stop.getDepartureDate() != null) {
            return new Anchor(position, stop.getArrivalDate(), stop.getDepartureDate(), true);
        }
        return null;
    }

    @Data
    public static class Resolution {

        /** 第一个元素永远是行程起点锚点 */
        private List<Anchor> anchors = new ArrayList<>();

        /** 标记为锁定、但日期不完整而被降级的站点 */
        private List<Stop> degradedStops = new ArrayList<>();

        /**
         * 除行程起点外是否还有生效的锁定站点。
         */
        public boolean hasStopAnchors() {
            return anchors.size() > 1;
        }
    }
}
