package com.roundtrip.pojo.dto;

import lombok.Data;

@Data
public class StopAddDTO {

    private ItineraryDTO itinerary;

    private StopDTO stop;

    /**
     * 插入到该站点之后；为空时追加到行程末尾。
     */
    private String insertAfterId;
}
