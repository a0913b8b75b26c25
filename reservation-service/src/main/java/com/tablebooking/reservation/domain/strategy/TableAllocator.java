package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.DiningTable;
import com.tablebooking.reservation.domain.model.Reservation;
import com.tablebooking.reservation.domain.repository.ReservationRepository;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.exception.BookingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Steps shared by all strategies. Runs inside the caller's transaction and opens none of its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAllocator {

    static final String NO_FREE_TABLES = "There are no free tables for this period of time";

    private final ReservationRepository reservationRepository;

    /**
     * Deletes the reservation being replaced. The deletion is visible to the availability
     * queries that follow in the same transaction.
     */
    public void releaseReplaced(AllocationCommand command) {
        if (!command.isReplace()) {
            return;
        }
        int deleted = reservationRepository.deleteReservationById(command.replaceId());
        if (deleted == 0) {
            throw new BookingException(ErrorKind.NOT_FOUND,
                    String.format("There are no reservations with id=%d", command.replaceId()));
        }
        log.debug("Released reservation {} for replacement", command.replaceId());
    }

    public Long book(DiningTable table, AllocationCommand command) {
        Reservation reservation = Reservation.builder()
                .tableId(table.getId())
                .startTime(command.window().start())
                .endTime(command.window().end())
                .partySize(command.partySize())
                .build();
        Reservation saved = reservationRepository.saveAndFlush(reservation);
        log.debug("Booked table {} (capacity {}) for {} guests in {}",
                table.getNumber(), table.getCapacity(), command.partySize(), command.window());
        return saved.getId();
    }

    /**
     * A replace that cannot be refilled is a conflict; a fresh request that cannot be met is not found.
     */
    public BookingException noFreeTable(AllocationCommand command) {
        ErrorKind kind = command.isReplace() ? ErrorKind.CONFLICT : ErrorKind.NOT_FOUND;
        return new BookingException(kind, NO_FREE_TABLES);
    }
}
