package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.DiningTable;
import com.tablebooking.reservation.domain.model.TimeWindow;
import com.tablebooking.reservation.domain.repository.DiningTableRepository;
import com.tablebooking.reservation.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Allocation using pessimistic locks (SELECT FOR UPDATE) on every table large enough for the party.
 *
 * Flow:
 * 1. Delete the replaced reservation, if any
 * 2. Lock the candidate tables, tightest fit first
 * 3. Pick the first candidate without an overlapping reservation
 * 4. Insert the reservation and commit (releases the locks)
 *
 * Two requests that could land on the same table share at least that table's lock, so the
 * second one runs its overlap check only after the first has committed its insert.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockAllocationStrategy implements AllocationStrategy {

    private final DiningTableRepository tableRepository;
    private final ReservationRepository reservationRepository;
    private final TableAllocator allocator;

    @Override
    @Transactional
    public Long allocate(AllocationCommand command) {
        allocator.releaseReplaced(command);

        List<DiningTable> candidates = tableRepository.findCandidatesWithLock(command.partySize());
        TimeWindow window = command.window();
        for (DiningTable table : candidates) {
            if (!reservationRepository.existsOverlapping(table.getId(), window.start(), window.end())) {
                return allocator.book(table, command);
            }
        }

        log.debug("No free table among {} candidates for {} guests in {}",
                candidates.size(), command.partySize(), window);
        throw allocator.noFreeTable(command);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
