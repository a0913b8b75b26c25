package com.tablebooking.reservation.exception;

import com.tablebooking.common.exception.BusinessException;
import com.tablebooking.reservation.domain.result.ErrorKind;
import lombok.Getter;

/**
 * Raised inside a booking transaction to abort it; the transaction rolls back before the
 * engine turns the exception into a {@code BookingResult.Err}.
 */
@Getter
public class BookingException extends BusinessException {

    private final ErrorKind kind;

    public BookingException(ErrorKind kind, String message) {
        super(message, kind.errorCode());
        this.kind = kind;
    }

    public BookingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause, kind.errorCode());
        this.kind = kind;
    }
}
