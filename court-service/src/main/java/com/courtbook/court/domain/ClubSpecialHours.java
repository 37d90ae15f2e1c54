package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Opening hours for one calendar date, overriding the weekly schedule.
 */
@Entity
@Table(name = "club_special_hours",
        uniqueConstraints = @UniqueConstraint(columnNames = {"club_id", "special_date"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClubSpecialHours extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "club_id", nullable = false)
    private Club club;

    @Column(name = "special_date", nullable = false)
    private LocalDate date;

    @Column(length = 5)
    private String openTime;

    @Column(length = 5)
    private String closeTime;

    @Column(nullable = false)
    private boolean closed;

    @Column(length = 200)
    private String reason;

    @Builder
    private ClubSpecialHours(Club club, LocalDate date, String openTime, String closeTime,
                             boolean closed, String reason) {
        this.club = club;
        this.date = date;
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.closed = closed;
        this.reason = reason;
    }

    public boolean hasHours() {
        return TimeRanges.isValidTimeFormat(openTime)
                && TimeRanges.isValidTimeFormat(closeTime)
                && TimeRanges.toMinutes(openTime) < TimeRanges.toMinutes(closeTime);
    }

    public TimeRange toTimeRange() {
        return TimeRange.of(openTime, closeTime);
    }
}
