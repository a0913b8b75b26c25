package com.tablebooking.reservation.domain.validation;

import com.tablebooking.reservation.domain.result.BookingResult;
import com.tablebooking.reservation.domain.result.ErrorKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw request parameters into a {@link ValidatedRequest}. Has no side effects.
 *
 * Bounds default to 1..10 guests and 0.5..6.0 hours, both inclusive.
 */
@Component
public class ReservationRequestValidator {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final int minGuests;
    private final int maxGuests;
    private final double minDuration;
    private final double maxDuration;
    private final ZoneId zone;

    public ReservationRequestValidator(@Value("${reservation.policy.min-guests:1}") int minGuests,
                                       @Value("${reservation.policy.max-guests:10}") int maxGuests,
                                       @Value("${reservation.policy.min-duration-hours:0.5}") double minDuration,
                                       @Value("${reservation.policy.max-duration-hours:6.0}") double maxDuration,
                                       @Value("${reservation.policy.zone:UTC}") String zone) {
        if (minGuests < 1 || maxGuests < minGuests) {
            throw new IllegalArgumentException("Invalid guest bounds: " + minGuests + ".." + maxGuests);
        }
        if (minDuration <= 0 || maxDuration < minDuration) {
            throw new IllegalArgumentException("Invalid duration bounds: " + minDuration + ".." + maxDuration);
        }
        this.minGuests = minGuests;
        this.maxGuests = maxGuests;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
        this.zone = ZoneId.of(zone);
    }

    public BookingResult<ValidatedRequest> validate(String guests, String time, String duration) {
        Integer partySize = parseInteger(guests);
        if (partySize == null) {
            return invalid("parameter guests must be integer");
        }
        if (partySize < minGuests || partySize > maxGuests) {
            return invalid(String.format("parameter guests must be in range >=%d and <= %d", minGuests, maxGuests));
        }

        if (!StrictIsoDateTime.matchesSyntax(time)) {
            return invalid("time does not match the following format yyyy-MM-ddThh:mm:ssZ or it's not a valid date/time.");
        }
        Optional<Instant> start = StrictIsoDateTime.parse(time, zone);
        if (start.isEmpty()) {
            return invalid("it's not a valid date/time.");
        }

        Double hours = parseReal(duration);
        if (hours == null) {
            return invalid("parameter duration must be float");
        }
        if (hours < minDuration || hours > maxDuration) {
            return invalid(String.format("parameter duration must be in range >=%s and <= %s", minDuration, maxDuration));
        }

        return BookingResult.ok(new ValidatedRequest(partySize, start.get(), hours));
    }

    private static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseReal(String value) {
        if (value == null || !DECIMAL.matcher(value.trim()).matches()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static <T> BookingResult<T> invalid(String message) {
        return BookingResult.err(ErrorKind.INVALID_INPUT, message);
    }
}
