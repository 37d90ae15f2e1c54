package com.courtbook.court.repository;

import com.courtbook.court.domain.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    @Query("""
            SELECT b FROM Booking b
            WHERE b.courtId IN :courtIds
              AND b.startAt < :to
              AND b.endAt > :from
            ORDER BY b.courtId, b.startAt
            """)
    List<Booking> findOverlapping(
            @Param("courtIds") Collection<Long> courtIds,
            @Param("from") Instant from,
            @Param("to") Instant to
    );
}
