package com.roundtrip.pojo.dto;

import lombok.Data;

/**
 * 拖拽排序请求：把 stopId 对应的站点放到 targetStopId 所在的位置。
 */
@Data
public class StopMoveDTO {

    private ItineraryDTO itinerary;

    private String stopId;

    private String targetStopId;
}
