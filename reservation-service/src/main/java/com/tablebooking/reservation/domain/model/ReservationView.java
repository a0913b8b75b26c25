package com.tablebooking.reservation.domain.model;

import java.time.Instant;

/**
 * Read model of a reservation together with the table it is bound to.
 */
public record ReservationView(
        Long id,
        Integer partySize,
        Instant start,
        Instant end,
        Integer tableNumber,
        Integer tableCapacity
) {
}
