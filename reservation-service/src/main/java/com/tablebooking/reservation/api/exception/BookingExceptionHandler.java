package com.tablebooking.reservation.api.exception;

import com.tablebooking.common.dto.BaseResponse;
import com.tablebooking.reservation.exception.BookingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps booking failures to status codes: INVALID_INPUT 400, NOT_FOUND 404, CONFLICT 409.
 * Ordered ahead of the shared handler, which would otherwise answer 400 for every business exception.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<BaseResponse<?>> handleBookingException(BookingException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
        };
        log.warn("{} : {}", status.value(), ex.getMessage());
        return ResponseEntity.status(status).body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }
}
