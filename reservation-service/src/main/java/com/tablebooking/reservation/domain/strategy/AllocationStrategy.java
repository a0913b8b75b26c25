package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.reservation.domain.model.AllocationCommand;

/**
 * Finds a free table for a window and books it, with a specific concurrency control mechanism.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the candidate tables
 * - serializable: SERIALIZABLE isolation, retried on serialization failure
 * - distributed: Redisson lock around the pessimistic allocation
 *
 * Every implementation runs the whole allocation in one transaction and signals failure with
 * {@link com.tablebooking.reservation.exception.BookingException}, which rolls it back.
 */
public interface AllocationStrategy {

    /**
     * Deletes the replaced reservation if any, then books the tightest free table.
     *
     * @param command Party size, window and optional reservation to replace
     * @return Id of the new reservation
     */
    Long allocate(AllocationCommand command);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, SERIALIZABLE, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
