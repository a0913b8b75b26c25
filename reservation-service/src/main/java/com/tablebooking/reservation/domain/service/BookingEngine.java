package com.tablebooking.reservation.domain.service;

import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.ReservationView;
import com.tablebooking.reservation.domain.repository.ReservationRepository;
import com.tablebooking.reservation.domain.result.BookingResult;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.domain.strategy.AllocationStrategy;
import com.tablebooking.reservation.exception.BookingException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Sole writer of reservations.
 *
 * Allocation is delegated to the {@link AllocationStrategy} named by
 * {@code reservation.allocation.strategy}; Spring injects every strategy bean into a map keyed
 * by bean name (pessimistic, serializable, distributed). Each strategy runs in its own
 * transaction and throws to roll it back, so by the time a failure reaches this class nothing
 * of the attempt is left in the store. The failure is then returned as a {@link BookingResult.Err}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingEngine {

    static final String DEFAULT_STRATEGY = "pessimistic";
    static final String CONTENTION_MESSAGE = "Tables for this period are being booked concurrently, please retry";

    private final Map<String, AllocationStrategy> allocationStrategies;
    private final ReservationRepository reservationRepository;

    @Value("${reservation.allocation.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        AllocationStrategy strategy = getAllocationStrategy();
        log.info("Initialized BookingEngine with strategy: {}", strategy.getStrategyType());
    }

    /**
     * Books the tightest free table for the command, replacing {@code command.replaceId()} atomically if set.
     *
     * @return Id of the new reservation, or NOT_FOUND / CONFLICT
     */
    public BookingResult<Long> allocate(AllocationCommand command) {
        AllocationStrategy strategy = getAllocationStrategy();
        try {
            return BookingResult.ok(strategy.allocate(command));
        } catch (BookingException e) {
            return BookingResult.err(e.getKind(), e.getMessage());
        } catch (ConcurrencyFailureException e) {
            log.warn("Allocation for {} guests in {} lost to concurrent bookings: {}",
                    command.partySize(), command.window(), e.getMessage());
            return BookingResult.err(ErrorKind.CONFLICT, CONTENTION_MESSAGE);
        }
    }

    public BookingResult<Void> release(Long id) {
        int deleted = reservationRepository.deleteReservationById(id);
        if (deleted == 0) {
            return BookingResult.err(ErrorKind.NOT_FOUND, notFoundMessage(id));
        }
        return BookingResult.ok(null);
    }

    public BookingResult<ReservationView> lookup(Long id) {
        return reservationRepository.findViewById(id)
                .<BookingResult<ReservationView>>map(BookingResult::ok)
                .orElseGet(() -> BookingResult.err(ErrorKind.NOT_FOUND, notFoundMessage(id)));
    }

    /**
     * Falls back to the pessimistic strategy if the configured one is not registered
     * (for example "distributed" while Redis is disabled).
     */
    private AllocationStrategy getAllocationStrategy() {
        String strategyKey = strategyType.toLowerCase();
        AllocationStrategy strategy = allocationStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, allocationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = allocationStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(DEFAULT_STRATEGY + " strategy not found. Available strategies: "
                        + allocationStrategies.keySet());
            }
        }
        return strategy;
    }

    private static String notFoundMessage(Long id) {
        return String.format("There are no reservations with id=%d", id);
    }
}
