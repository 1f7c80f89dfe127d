package com.roundtrip.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 行程排期配置属性。
 * Itinerary scheduling configuration.
 */
@Data
@ConfigurationProperties(prefix = "roundtrip.itinerary")
public class ItineraryProperties {

    /**
     * 请求与行程本身都没有起始日期时使用的默认起始日期（YYYY-MM-DD）。
     * 置空表示不兜底：此时跳过重算，保持站点日期不变。
     */
    private String defaultStartDate = "2026-06-12";

    /**
     * 新增站点未指定停留天数时的默认值。
     * Default stay length for newly added stops.
     */
    private int defaultDurationDays = 1;
}
