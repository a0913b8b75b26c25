package com.tablebooking.reservation.api.dto;

/**
 * Body of create and update requests: {@code {"reservation": {"guests": 4, "time": "...", "duration": 1.5}}}.
 * Values stay untyped here; numbers arrive as their JSON text and are checked by the validator.
 */
public record ReservationRequest(ReservationParams reservation) {

    public record ReservationParams(String guests, String time, String duration) {
    }
}
