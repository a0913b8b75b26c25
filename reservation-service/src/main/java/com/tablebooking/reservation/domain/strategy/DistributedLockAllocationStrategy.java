package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.common.util.Constants;
import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.exception.BookingException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Allocation behind a Redis (Redisson) lock shared by all service instances.
 *
 * The lock is taken before the database transaction starts and released after it commits,
 * so no other instance can run an overlap check against uncommitted state. The transaction
 * itself is the pessimistic one, which keeps the database guarantee when Redis is unavailable
 * to some instance.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(prefix = "reservation.redis", name = "enabled", havingValue = "true")
public class DistributedLockAllocationStrategy implements AllocationStrategy {

    private final RedissonClient redissonClient;
    private final PessimisticLockAllocationStrategy delegate;
    private final long waitSeconds;
    private final long leaseSeconds;

    public DistributedLockAllocationStrategy(RedissonClient redissonClient,
                                             PessimisticLockAllocationStrategy delegate,
                                             @Value("${reservation.allocation.lock-wait-seconds:5}") long waitSeconds,
                                             @Value("${reservation.allocation.lock-lease-seconds:30}") long leaseSeconds) {
        this.redissonClient = redissonClient;
        this.delegate = delegate;
        this.waitSeconds = waitSeconds;
        this.leaseSeconds = leaseSeconds;
    }

    @Override
    public Long allocate(AllocationCommand command) {
        RLock lock = redissonClient.getLock(Constants.ALLOCATION_LOCK);
        try {
            boolean acquired = lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new BookingException(ErrorKind.CONFLICT,
                        "Unable to acquire lock for table allocation. Please try again.");
            }

            log.debug("Acquired distributed lock: {}", Constants.ALLOCATION_LOCK);
            return delegate.allocate(command);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Table allocation interrupted", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", Constants.ALLOCATION_LOCK);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
