package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a court booking over {@code [startAt, endAt)}.
 */
@Entity
@Table(name = "bookings", indexes = @Index(name = "idx_bookings_court_start", columnList = "court_id, start_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "court_id", nullable = false)
    private Long courtId;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Builder
    private Booking(Long courtId, Instant startAt, Instant endAt, BookingStatus status) {
        this.courtId = courtId;
        this.startAt = startAt;
        this.endAt = endAt;
        this.status = status != null ? status : BookingStatus.PENDING;
    }

    public boolean overlaps(Instant from, Instant to) {
        return TimeRanges.overlaps(startAt, endAt, from, to);
    }

    public boolean covers(Instant from, Instant to) {
        return !startAt.isAfter(from) && !endAt.isBefore(to);
    }

    public boolean blocks(Instant from, Instant to) {
        return status.isLive() && overlaps(from, to);
    }
}
