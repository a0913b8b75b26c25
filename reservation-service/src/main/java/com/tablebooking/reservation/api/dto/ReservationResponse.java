package com.tablebooking.reservation.api.dto;

import com.tablebooking.reservation.domain.model.ReservationView;

import java.time.Instant;

/**
 * {@code {"reservation": {id, guests, start, end, table: {number, capacity}}}}
 */
public record ReservationResponse(Details reservation) {

    public record Details(Long id, Integer guests, Instant start, Instant end, TableInfo table) {
    }

    public record TableInfo(Integer number, Integer capacity) {
    }

    public static ReservationResponse from(ReservationView view) {
        return new ReservationResponse(new Details(
                view.id(),
                view.partySize(),
                view.start(),
                view.end(),
                new TableInfo(view.tableNumber(), view.tableCapacity())
        ));
    }
}
