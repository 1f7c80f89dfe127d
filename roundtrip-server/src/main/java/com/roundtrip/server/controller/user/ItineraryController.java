package com.roundtrip.server.controller.user;

import com.roundtrip.common.result.ErrorCode;
import com.roundtrip.common.result.Result;
import com.roundtrip.common.utils.DateUtil;
import com.roundtrip.pojo.dto.ItineraryDTO;
import com.roundtrip.pojo.dto.StopAddDTO;
import com.roundtrip.pojo.dto.StopEditDTO;
import com.roundtrip.pojo.dto.StopMoveDTO;
import com.roundtrip.pojo.entity.Trip;
import com.roundtrip.pojo.vo.ScheduleResultVO;
import com.roundtrip.server.convert.ItineraryConverter;
import com.roundtrip.server.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 行程排期接口。
 *
 * 服务端无状态：每个请求都携带整份行程，返回重算后的行程、冲突列表与降级提示，
 * 由调用方负责保存。
 */
@RestController
@RequestMapping("/user/itinerary")
@RequiredArgsConstructor
public class ItineraryController {

    private final ItineraryService itineraryService;
    private final ItineraryConverter itineraryConverter;

    /**
     * 全量重算；startDate 可选，不传时使用行程已保存的起始日期。
     */
    @PostMapping("/recalculate")
    public Result<ScheduleResultVO> recalculate(@RequestBody ItineraryDTO dto,
                                                @RequestParam(required = false) String startDate) {
        if (dto == null) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto);
        return Result.success(itineraryService.recalculate(trip, DateUtil.parseDate(startDate)));
    }

    /**
     * 修改站点停留天数。
     */
    @PutMapping("/stop/duration")
    public Result<ScheduleResultVO> changeDuration(@RequestBody StopEditDTO dto) {
        if (!hasStop(dto)) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.changeDuration(trip, dto.getStopId(), dto.getDurationDays()));
    }

    /**
     * 切换站点日期锁定。
     */
    @PostMapping("/stop/lock")
    public Result<ScheduleResultVO> toggleLock(@RequestBody StopEditDTO dto) {
        if (!hasStop(dto)) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.toggleLock(trip, dto.getStopId()));
    }

    /**
     * 编辑锁定站点的到达/离开日期。
     */
    @PutMapping("/stop/locked-dates")
    public Result<ScheduleResultVO> updateLockedDates(@RequestBody StopEditDTO dto) {
        if (!hasStop(dto)) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.updateLockedDates(trip, dto.getStopId(),
                DateUtil.parseDate(dto.getLockedArrivalDate()),
                DateUtil.parseDate(dto.getLockedDepartureDate())));
    }

    /**
     * 新增站点。
     */
    @PostMapping("/stop")
    public Result<ScheduleResultVO> addStop(@RequestBody StopAddDTO dto) {
        if (dto == null || dto.getItinerary() == null || dto.getStop() == null) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.addStop(trip,
                itineraryConverter.toStop(dto.getStop()), dto.getInsertAfterId()));
    }

    /**
     * 删除站点（请求体需要携带整份行程，所以用 POST 而不是 DELETE）。
     */
    @PostMapping("/stop/remove")
    public Result<ScheduleResultVO> removeStop(@RequestBody StopEditDTO dto) {
        if (!hasStop(dto)) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.removeStop(trip, dto.getStopId()));
    }

    /**
     * 拖拽排序。
     */
    @PostMapping("/stop/move")
    public Result<ScheduleResultVO> moveStop(@RequestBody StopMoveDTO dto) {
        if (dto == null || dto.getItinerary() == null
                || !StringUtils.hasText(dto.getStopId()) || !StringUtils.hasText(dto.getTargetStopId())) {
            return Result.error(ErrorCode.ITINERARY_INVALID_PARAM);
        }
        Trip trip = itineraryConverter.toTrip(dto.getItinerary());
        return Result.success(itineraryService.moveStop(trip, dto.getStopId(), dto.getTargetStopId()));
    }

    private boolean hasStop(StopEditDTO dto) {
        return dto != null && dto.getItinerary() != null && StringUtils.hasText(dto.getStopId());
    }
}
