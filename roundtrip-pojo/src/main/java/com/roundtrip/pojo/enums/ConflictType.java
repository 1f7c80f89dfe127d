package com.roundtrip.pojo.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 日期冲突类型，序列化为小写下划线形式（overlap / gap / duration_exceeded）。
 */
public enum ConflictType {

    /** 相邻两站日期重叠 */
    OVERLAP("overlap"),

    /** 相邻两站之间有未安排的空档 */
    GAP("gap"),

    /** 首末锁定站之间的总停留天数超过可用天数 */
    DURATION_EXCEEDED("duration_exceeded");

    private final String code;

    ConflictType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
