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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SerializableAllocationStrategyTest {

    private static final TimeWindow WINDOW = TimeWindow.of(Instant.parse("2024-06-01T19:00:00Z"), 2.0);

    @Mock
    private DiningTableRepository tableRepository;

    @Mock
    private ReservationRepository reservationRepository;

    private SerializableAllocationStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new SerializableAllocationStrategy(tableRepository, new TableAllocator(reservationRepository));
    }

    @Test
    void allocate_booksFirstFreeTable() {
        DiningTable four = DiningTable.builder().id(2L).number(2).capacity(4).build();
        DiningTable six = DiningTable.builder().id(3L).number(3).capacity(6).build();
        given(tableRepository.findFreeTables(4, WINDOW.start(), WINDOW.end())).willReturn(List.of(four, six));
        given(reservationRepository.saveAndFlush(any(Reservation.class)))
                .willAnswer(inv -> Reservation.builder().id(9L).tableId(inv.<Reservation>getArgument(0).getTableId()).build());

        Long id = strategy.allocate(AllocationCommand.create(4, WINDOW));

        assertThat(id).isEqualTo(9L);
        ArgumentCaptor<Reservation> saved = ArgumentCaptor.forClass(Reservation.class);
        verify(reservationRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getTableId()).isEqualTo(2L);
    }

    @Test
    void allocate_noFreeTable() {
        given(tableRepository.findFreeTables(4, WINDOW.start(), WINDOW.end())).willReturn(List.of());

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.create(4, WINDOW)))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void allocate_replaceWithoutFreeTable_conflict() {
        given(reservationRepository.deleteReservationById(5L)).willReturn(1);
        given(tableRepository.findFreeTables(4, WINDOW.start(), WINDOW.end())).willReturn(List.of());

        assertThatThrownBy(() -> strategy.allocate(AllocationCommand.replace(5L, 4, WINDOW)))
                .isInstanceOf(BookingException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    void getStrategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("SERIALIZABLE");
    }
}
