package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Weekly opening hours of a club. {@code dayOfWeek} uses Sunday = 0.
 */
@Entity
@Table(name = "club_business_hours",
        uniqueConstraints = @UniqueConstraint(columnNames = {"club_id", "day_of_week"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClubBusinessHours extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "club_id", nullable = false)
    private Club club;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(length = 5)
    private String openTime;

    @Column(length = 5)
    private String closeTime;

    @Column(nullable = false)
    private boolean closed;

    @Builder
    private ClubBusinessHours(Club club, int dayOfWeek, String openTime, String closeTime, boolean closed) {
        this.club = club;
        this.dayOfWeek = dayOfWeek;
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.closed = closed;
    }

    /**
     * Whether both times are present, well-formed and open before close.
     */
    public boolean hasHours() {
        return TimeRanges.isValidTimeFormat(openTime)
                && TimeRanges.isValidTimeFormat(closeTime)
                && TimeRanges.toMinutes(openTime) < TimeRanges.toMinutes(closeTime);
    }

    public TimeRange toTimeRange() {
        return TimeRange.of(openTime, closeTime);
    }
}
