package com.roundtrip.server.schedule;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

/**
 * 排期锚点：行程起点（position = -1）或某个锁定站点（position = 站点下标）。
 * <p>只在一次重算内存在，是对站点列表的一个“视图”，不落库。</p>
 */
@Data
@AllArgsConstructor
public class Anchor {

    private int position;

    private LocalDate arrivalDate;

    /**
     * 行程起点锚点没有离开日期，为 null。
     */
    private LocalDate departureDate;

    private boolean locked;
}
