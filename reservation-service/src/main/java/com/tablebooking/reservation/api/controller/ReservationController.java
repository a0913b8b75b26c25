package com.tablebooking.reservation.api.controller;

import com.tablebooking.common.dto.BaseResponse;
import com.tablebooking.common.util.Constants;
import com.tablebooking.reservation.api.dto.ReservationCreatedResponse;
import com.tablebooking.reservation.api.dto.ReservationRequest;
import com.tablebooking.reservation.api.dto.ReservationResponse;
import com.tablebooking.reservation.domain.model.ReservationView;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.domain.service.ReservationService;
import com.tablebooking.reservation.exception.BookingException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

/**
 * REST controller for reservations.
 * Both create and update answer 201 with the Location of the (new) reservation: an update
 * always issues a new id.
 */
@RestController
@RequestMapping(Constants.RESERVATIONS_PATH)
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    public ResponseEntity<BaseResponse<ReservationCreatedResponse>> createReservation(
            @RequestBody ReservationRequest request) {
        Long id = reservationService.createReservation(request).orElseThrow();
        return created(id, "Reservation created successfully");
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(@PathVariable("id") String id) {
        ReservationView view = reservationService.getReservation(parseId(id)).orElseThrow();
        return ResponseEntity.ok(BaseResponse.success(ReservationResponse.from(view)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationCreatedResponse>> updateReservation(
            @PathVariable("id") String id,
            @RequestBody ReservationRequest request) {
        Long newId = reservationService.updateReservation(parseId(id), request).orElseThrow();
        return created(newId, "Reservation replaced successfully");
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteReservation(@PathVariable("id") String id) {
        reservationService.deleteReservation(parseId(id)).orElseThrow();
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<BaseResponse<ReservationCreatedResponse>> created(Long id, String message) {
        return ResponseEntity.created(URI.create(Constants.RESERVATIONS_PATH + "/" + id))
                .body(BaseResponse.success(message, new ReservationCreatedResponse(id)));
    }

    private static Long parseId(String raw) {
        try {
            return Long.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new BookingException(ErrorKind.INVALID_INPUT, "parameter id must be integer", e);
        }
    }
}
