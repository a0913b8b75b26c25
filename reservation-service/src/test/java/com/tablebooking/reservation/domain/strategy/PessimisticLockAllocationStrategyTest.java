package com.tablebooking.reservation.domain.strategy;

import com.tablebooking.reservation.domain.model.AllocationCommand;
import com.tablebooking.reservation.domain.model.DiningTable;
import com.tablebooking.reservation.domain.model.Reservation;
import com.tablebooking.reservation.domain.model.TimeWindow;
import com.tablebooking.reservation.domain.repository.DiningTableRepository;
import com.tablebooking.reservation.domain.repository.ReservationRepository;
import com.tablebooking.reservation.domain.result.ErrorKind;
import com.tablebooking.reservation.exception.BookingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PessimisticLockAllocationStrategy}: candidate order, overlap skipping,
 * and the NOT_FOUND / CONFLICT split.
 */
@ExtendWith(MockitoExtension.class)
class PessimisticLockAllocationStrategyTest {

    private static final TimeWindow WINDOW = TimeWindow.of(Instant.parse("2024-06-01T10:00:00Z"), 1.0);

    private static final DiningTable SMALL = DiningTable.builder().id(1L).number(1).capacity(2).build();
    private static final DiningTable MEDIUM = DiningTable.builder().id(2L).number(2).capacity(4).build();
    private static final DiningTable LARGE = DiningTable.builder().id(3L).number(3).capacity(6).build();

    @Mock
    private DiningTableRepository tableRepository;

    @Mock
    private ReservationRepository reservationRepository;

    private PessimisticLockAllocationStrategy strategy;

    @BeforeEach
    void setUp() {
        TableAllocator allocator = new TableAllocator(reservationRepository);
        strategy = new PessimisticLockAllocationStrategy(tableRepository, reservationRepository, allocator);
        lenient().when(reservationRepository.saveAndFlush(any(Reservation.class))).thenAnswer(inv -> {
            Reservation r = inv.getArgument(0);
            return Reservation.builder()
                    .id(100L)
                    .tableId(r.getTableId())
                    .startTime(r.getStartTime())
                    .endTime(r.getEndTime())
                    .partySize(r.getPartySize())
                    .build();
        });
    }

    @Test
    @DisplayName("allocate() books the first free candidate, which is the tightest fit")
    void allocate_picksTightestFreeTable() {
        given(tableRepository.findCandidatesWithLock(3)).willReturn(List.of(MEDIUM, LARGE));
        given(reservationRepository.existsOverlapping(MEDIUM.getId(), WINDOW.start(), WINDOW.end())).willReturn(false);

        Long id = strategy.allocate(AllocationCommand.create(3, WINDOW));

        assertThat(id).isEqualTo(100L);
        ArgumentCaptor<Reservation> saved = ArgumentCaptor.forClass(Reservation.class);
        verify(reservationRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getTableId()).isEqualTo(MEDIUM.getId());
        assertThat(saved.getValue().getPartySize()).isEqualTo(3);
        assertThat(saved.getValue().getStartTime()).isEqualTo(WINDOW.start());
        assertThat(saved.getValue().getEndTime()).isEqualTo(WINDOW.end());
        verify(reservationRepository, never()).existsOverlapping(eq(LARGE.getId()), any(), any());
    }

    @Test
    @DisplayName("allocate() skips occupied candidates")
    void allocate_skipsOccupiedTables() {
        given(tableRepository.findCandidatesWithLock(2)).willReturn(List.of(SMALL, MEDIUM, LARGE));
        given(reservationRepository.existsOverlapping(SMALL.getId(), WINDOW.start(), WINDOW.end())).willReturn(true);
        given(reservationRepository.existsOverlapping(MEDIUM.getId(), WINDOW.start(), WINDOW.end())).willReturn(true);
        given(reservationRepository.existsOverlapping(LARGE.getId(), WINDOW.start(), WINDOW.end())).willReturn(false);

        strategy.allocate(AllocationCommand.create(2, WINDOW));

        ArgumentCaptor<Reservation> saved = ArgumentCaptor.forClass(Reservation.class);
        verify(reservationRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getTableId()).isEqualTo(LARGE.getId());
    }

    @Test
    @DisplayName("allocate() fails with NOT_FOUND when a fresh request finds no table")
    void allocate_freshRequestWithoutTable_notFound() {
        given(tableRepository.findCandidatesWithLock(2)).willReturn(List.of(SMALL));
        given(reservationRepository.existsOverlapping(SMALL.getId(), WINDOW.start(), WINDOW.end())).willReturn(true);

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.create(2, WINDOW)))
                .isInstanceOf(BookingException.class)
                .hasMessage("There are no free tables for this period of time")
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FOUND);
        verify(reservationRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("allocate() fails with NOT_FOUND when no table is large enough")
    void allocate_noCandidate_notFound() {
        given(tableRepository.findCandidatesWithLock(8)).willReturn(List.of());

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.create(8, WINDOW)))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("allocate() fails with CONFLICT when a replacement finds no table")
    void allocate_replaceWithoutTable_conflict() {
        given(reservationRepository.deleteReservationById(7L)).willReturn(1);
        given(tableRepository.findCandidatesWithLock(2)).willReturn(List.of(SMALL));
        given(reservationRepository.existsOverlapping(SMALL.getId(), WINDOW.start(), WINDOW.end())).willReturn(true);

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.replace(7L, 2, WINDOW)))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    @DisplayName("allocate() deletes the replaced reservation before locking and checking candidates")
    void allocate_replace_deletesFirst() {
        given(reservationRepository.deleteReservationById(7L)).willReturn(1);
        given(tableRepository.findCandidatesWithLock(2)).willReturn(List.of(SMALL));
        given(reservationRepository.existsOverlapping(SMALL.getId(), WINDOW.start(), WINDOW.end())).willReturn(false);

        Long id = strategy.allocate(AllocationCommand.replace(7L, 2, WINDOW));

        assertThat(id).isEqualTo(100L);
        InOrder inOrder = inOrder(reservationRepository, tableRepository);
        inOrder.verify(reservationRepository).deleteReservationById(7L);
        inOrder.verify(tableRepository).findCandidatesWithLock(2);
        inOrder.verify(reservationRepository).saveAndFlush(any(Reservation.class));
    }

    @Test
    @DisplayName("allocate() fails with NOT_FOUND and stops when the replaced reservation does not exist")
    void allocate_replaceUnknownId_notFound() {
        given(reservationRepository.deleteReservationById(42L)).willReturn(0);

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.replace(42L, 2, WINDOW)))
                .isInstanceOf(BookingException.class)
                .hasMessage("There are no reservations with id=42")
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FOUND);
        verifyNoInteractions(tableRepository);
        verify(reservationRepository, never()).saveAndFlush(any());
    }
}
