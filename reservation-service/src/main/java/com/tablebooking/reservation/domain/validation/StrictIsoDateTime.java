package com.tablebooking.reservation.domain.validation;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the ISO-8601 extended date-time form accepted by the booking API:
 * {@code [-]YYYY[Y...]-MM-DDThh:mm:ss[.fraction][Z]}.
 *
 * Syntax is checked first, then the fields must form a real calendar date (no February 30th).
 * A value without {@code Z} is read in the supplied default zone.
 *
 * Accepted instants run from {@link #MIN_INSTANT} to {@link #MAX_INSTANT}: the upper bound is the
 * last instant an ECMAScript {@code Date} can hold (8.64e15 ms after the epoch), the lower bound
 * keeps values inside the PostgreSQL {@code timestamptz} range (which ends at 4713 BC).
 */
public final class StrictIsoDateTime {

    private static final Pattern ISO_DATE_TIME = Pattern.compile(
            "^(-?(?:[1-9][0-9]*)?[0-9]{4})-(1[0-2]|0[1-9])-(3[01]|0[1-9]|[12][0-9])"
                    + "T(2[0-3]|[01][0-9]):([0-5][0-9]):([0-5][0-9])(\\.[0-9]+)?(Z)?$");

    public static final Instant MIN_INSTANT = LocalDateTime.of(-4712, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);
    public static final Instant MAX_INSTANT = Instant.ofEpochMilli(8_640_000_000_000_000L);

    private static final int NANO_DIGITS = 9;

    private StrictIsoDateTime() {
        // Utility class
    }

    public static boolean matchesSyntax(String value) {
        return value != null && ISO_DATE_TIME.matcher(value).matches();
    }

    public static Optional<Instant> parse(String value, ZoneId defaultZone) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher m = ISO_DATE_TIME.matcher(value);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            LocalDateTime local = LocalDateTime.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)),
                    Integer.parseInt(m.group(5)),
                    Integer.parseInt(m.group(6)),
                    nanos(m.group(7)));
            ZoneId zone = m.group(8) != null ? ZoneOffset.UTC : defaultZone;
            Instant instant = local.atZone(zone).toInstant();
            if (instant.isBefore(MIN_INSTANT) || instant.isAfter(MAX_INSTANT)) {
                return Optional.empty();
            }
            return Optional.of(instant);
        } catch (DateTimeException | NumberFormatException e) {
            // impossible calendar date, or a year outside the supported range
            return Optional.empty();
        }
    }

    // ".5" -> 500_000_000; digits past nanoseconds are dropped
    private static int nanos(String fraction) {
        if (fraction == null) {
            return 0;
        }
        String digits = fraction.substring(1);
        if (digits.length() > NANO_DIGITS) {
            digits = digits.substring(0, NANO_DIGITS);
        }
        StringBuilder padded = new StringBuilder(digits);
        while (padded.length() < NANO_DIGITS) {
            padded.append('0');
        }
        return Integer.parseInt(padded.toString());
    }
}
