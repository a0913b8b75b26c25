package com.tablebooking.common.util;

/**
 * Constants shared across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:tables:";
    public static final String ALLOCATION_LOCK = LOCK_PREFIX + "allocation";

    public static final String RESERVATIONS_PATH = "/api/reservations";
    public static final String TABLES_PATH = "/api/tables";
}
