package com.tablebooking.reservation.domain.result;

import com.tablebooking.reservation.exception.BookingException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a booking operation: either a value or a failure kind with a message.
 *
 * @param <T> Type of the successful value
 */
public sealed interface BookingResult<T> permits BookingResult.Ok, BookingResult.Err {

    static <T> BookingResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> BookingResult<T> err(ErrorKind kind, String message) {
        return new Err<>(kind, message);
    }

    boolean isOk();

    <U> BookingResult<U> flatMap(Function<? super T, BookingResult<U>> next);

    /**
     * Unwraps the value, raising {@link BookingException} for a failure.
     */
    T orElseThrow();

    record Ok<T>(T value) implements BookingResult<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public <U> BookingResult<U> flatMap(Function<? super T, BookingResult<U>> next) {
            return next.apply(value);
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Err<T>(ErrorKind kind, String message) implements BookingResult<T> {

        public Err {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public <U> BookingResult<U> flatMap(Function<? super T, BookingResult<U>> next) {
            return new Err<>(kind, message);
        }

        @Override
        public T orElseThrow() {
            throw new BookingException(kind, message);
        }
    }
}
