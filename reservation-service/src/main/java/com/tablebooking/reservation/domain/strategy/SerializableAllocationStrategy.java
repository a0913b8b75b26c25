package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.reservation.config.SerializableStoreCondition;
import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.DiningTable;
import com.tablebooking.reservation.domain.model.TimeWindow;
import com.tablebooking.reservation.domain.repository.DiningTableRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Conditional;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Allocation under SERIALIZABLE isolation with retry.
 *
 * The overlap check runs inside the database (NOT EXISTS subquery) without row locks. When two
 * transactions read the same free slot and both insert, the database aborts one of them with a
 * serialization failure; that attempt is rolled back and retried up to 3 times. Once retries are
 * exhausted the failure reaches the engine, which reports it as a conflict.
 *
 * Only registered when the datasource enforces SERIALIZABLE (see {@link SerializableStoreCondition});
 * elsewhere the engine uses the pessimistic strategy instead.
 *
 * Benefits:
 * - No lock queueing for requests on disjoint windows
 * - Good for moderate contention
 */
@Component("serializable")
@Conditional(SerializableStoreCondition.class)
@RequiredArgsConstructor
public class SerializableAllocationStrategy implements AllocationStrategy {

    private final DiningTableRepository tableRepository;
    private final TableAllocator allocator;

    @Override
    @Retryable(
            retryFor = ConcurrencyFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Long allocate(AllocationCommand command) {
        allocator.releaseReplaced(command);

        TimeWindow window = command.window();
        List<DiningTable> free = tableRepository.findFreeTables(command.partySize(), window.start(), window.end());
        if (free.isEmpty()) {
            throw allocator.noFreeTable(command);
        }
        return allocator.book(free.get(0), command);
    }

    @Override
    public String getStrategyType() {
        return "SERIALIZABLE";
    }
}
