package com.tablebooking.reservation.domain.result;

/**
 * Why a booking operation failed.
 */
public enum ErrorKind {
    /** Malformed or out-of-range parameters. The caller must correct the request. */
    INVALID_INPUT,
    /** Unknown reservation id, or no table can hold a new reservation. */
    NOT_FOUND,
    /** No table can hold the replacement of an existing reservation. */
    CONFLICT;

    public String errorCode() {
        return name();
    }
}
