package com.tablebooking.common.exception;

import lombok.Getter;

/**
 * Base class for failures caused by the request rather than by the infrastructure.
 * Subclasses choose the error code; the default handler reports it as 400.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
