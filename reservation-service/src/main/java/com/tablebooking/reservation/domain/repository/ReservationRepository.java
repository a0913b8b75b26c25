package com.tablebooking.reservation.domain.repository;

import com.tablebooking.reservation.domain.model.Reservation;
import com.tablebooking.reservation.domain.model.ReservationView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /**
     * True if the table has a reservation sharing at least one instant with {@code [start, end]}.
     */
    @Query("""
           SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
           FROM Reservation r
           WHERE r.tableId = :tableId
             AND r.startTime <= :end
             AND r.endTime >= :start
           """)
    boolean existsOverlapping(@Param("tableId") Long tableId,
                              @Param("start") Instant start,
                              @Param("end") Instant end);

    @Query("""
           SELECT new com.tablebooking.reservation.domain.model.ReservationView(
                  r.id, r.partySize, r.startTime, r.endTime, t.number, t.capacity)
           FROM Reservation r JOIN DiningTable t ON t.id = r.tableId
           WHERE r.id = :id
           """)
    Optional<ReservationView> findViewById(@Param("id") Long id);

    /**
     * Single-statement delete. Returns the number of rows removed (0 or 1).
     * Joins the caller's transaction when there is one.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.id = :id")
    int deleteReservationById(@Param("id") Long id);
}
