package com.roundtrip.common.result;

/**
 * 行程编辑相关的错误码枚举。
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 请求参数不合法（为空、JSON 无法解析等） */
    ITINERARY_INVALID_PARAM(2001, "请求参数不合法"),

    /** 指定的站点在行程中不存在 */
    STOP_NOT_FOUND(2002, "站点不存在"),

    /** 站点日期已锁定，不允许修改停留天数 */
    STOP_DATE_LOCKED(2003, "站点日期已锁定，请先解锁再修改停留天数"),

    /** 站点未锁定，不能编辑锁定日期 */
    STOP_NOT_LOCKED(2004, "站点未锁定，不能编辑锁定日期"),

    /** 行程至少需要保留一个站点 */
    LAST_STOP_REMOVAL(2005, "行程至少需要保留一个目的地"),

    /** 站点 id 重复 */
    DUPLICATE_STOP_ID(2006, "站点 id 已存在");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
