package com.tablebooking.reservation.domain.repository;

import com.tablebooking.reservation.domain.model.DiningTable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the table catalog.
 * Candidate lists are always ordered tightest fit first: capacity ascending, then id.
 */
public interface DiningTableRepository extends JpaRepository<DiningTable, Long> {

    List<DiningTable> findAllByOrderByCapacityAscIdAsc();

    /**
     * Locks every table large enough for the party (SELECT FOR UPDATE).
     * Concurrent allocations competing for any of these tables queue here until the holder commits.
     * Rows are locked in the same global order by every caller.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM DiningTable t WHERE t.capacity >= :partySize ORDER BY t.capacity ASC, t.id ASC")
    List<DiningTable> findCandidatesWithLock(@Param("partySize") int partySize);

    /**
     * Tables large enough for the party with no reservation touching {@code [start, end]}.
     * The overlap test is inclusive on both ends.
     */
    @Query("""
           SELECT t FROM DiningTable t
           WHERE t.capacity >= :partySize
             AND NOT EXISTS (
                 SELECT r.id FROM Reservation r
                 WHERE r.tableId = t.id
                   AND r.startTime <= :end
                   AND r.endTime >= :start)
           ORDER BY t.capacity ASC, t.id ASC
           """)
    List<DiningTable> findFreeTables(@Param("partySize") int partySize,
                                     @Param("start") Instant start,
                                     @Param("end") Instant end);
}
