package com.tablebooking.reservation.domain.service;

import com.tablebooking.reservation.api.dto.ReservationRequest;
import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.ReservationView;
import com.tablebooking.reservation.domain.result.BookingResult;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.domain.validation.ReservationRequestValidator;
import com.tablebooking.reservation.domain.validation.ValidatedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * Entry point for the four reservation operations: validate, then hand over to the engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private final ReservationRequestValidator validator;
    private final BookingEngine bookingEngine;

    public BookingResult<Long> createReservation(ReservationRequest request) {
        return withParams(request, params -> createReservation(params.guests(), params.time(), params.duration()));
    }

    public BookingResult<Long> createReservation(String guests, String time, String duration) {
        BookingResult<Long> result = validator.validate(guests, time, duration)
                .flatMap(valid -> bookingEngine.allocate(AllocationCommand.create(valid.partySize(), valid.window())));
        logOutcome("Created", null, result);
        return result;
    }

    public BookingResult<Long> updateReservation(Long id, ReservationRequest request) {
        return withParams(request, params -> updateReservation(id, params.guests(), params.time(), params.duration()));
    }

    /**
     * Replaces reservation {@code id} with a new one. The new reservation gets a new id; on failure
     * the old one is left untouched.
     */
    public BookingResult<Long> updateReservation(Long id, String guests, String time, String duration) {
        BookingResult<Long> result = validator.validate(guests, time, duration)
                .flatMap(valid -> bookingEngine.allocate(replaceCommand(id, valid)));
        logOutcome("Replaced", id, result);
        return result;
    }

    public BookingResult<Void> deleteReservation(Long id) {
        BookingResult<Void> result = bookingEngine.release(id);
        if (result.isOk()) {
            log.info("Deleted reservation {}", id);
        }
        return result;
    }

    public BookingResult<ReservationView> getReservation(Long id) {
        return bookingEngine.lookup(id);
    }

    private static AllocationCommand replaceCommand(Long id, ValidatedRequest valid) {
        return AllocationCommand.replace(id, valid.partySize(), valid.window());
    }

    private static BookingResult<Long> withParams(ReservationRequest request,
                                                  Function<ReservationRequest.ReservationParams, BookingResult<Long>> action) {
        if (request == null || request.reservation() == null) {
            return BookingResult.err(ErrorKind.INVALID_INPUT, "Object reservation is required");
        }
        return action.apply(request.reservation());
    }

    private static void logOutcome(String action, Long replacedId, BookingResult<Long> result) {
        if (result instanceof BookingResult.Ok<Long> ok) {
            if (replacedId == null) {
                log.info("{} reservation {}", action, ok.value());
            } else {
                log.info("{} reservation {} with {}", action, replacedId, ok.value());
            }
        } else if (result instanceof BookingResult.Err<Long> err) {
            log.info("Reservation request rejected ({}): {}", err.kind(), err.message());
        }
    }
}
