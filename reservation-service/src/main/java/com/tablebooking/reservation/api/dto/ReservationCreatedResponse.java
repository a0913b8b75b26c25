package com.tablebooking.reservation.api.dto;

public record ReservationCreatedResponse(Long id) {
}
