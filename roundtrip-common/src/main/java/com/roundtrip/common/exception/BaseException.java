package com.roundtrip.common.exception;

import com.roundtrip.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为友好的错误响应。
 * <p>只用于行程编辑操作中的“业务规则不通过”（站点不存在、站点已锁定等），
 * 排期引擎本身对任何输入都不会抛出异常。</p>
 */
public class BaseException extends RuntimeException {

    /**
     * 业务错误码；未指定时使用通用错误码兜底。
     */
    private final Integer code;

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public Integer getCode() {
        return code;
    }
}
