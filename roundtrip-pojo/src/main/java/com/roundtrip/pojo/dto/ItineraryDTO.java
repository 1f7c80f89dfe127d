package com.roundtrip.pojo.dto;

import lombok.Data;

import java.util.List;

/**
 * 完整行程请求体：服务端无状态，每次编辑都携带整份行程。
 */
@Data
public class ItineraryDTO {
    private String title;
    private String startDate;
    private Boolean startDateLocked;
    private Boolean endDateLocked;
    private List<StopDTO> stops;
}
