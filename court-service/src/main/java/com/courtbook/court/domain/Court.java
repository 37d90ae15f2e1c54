package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "courts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Court extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "club_id", nullable = false)
    private Club club;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String slug;

    @Column(length = 50)
    private String type;

    @Column(length = 50)
    private String surface;

    @Column(nullable = false)
    private boolean indoor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SportType sportType;

    /** Hourly rate in minor currency units. */
    @Column(nullable = false)
    private int defaultPriceCents;

    @Column(nullable = false)
    private boolean published;

    @Column(nullable = false)
    private boolean active;

    @Builder
    private Court(Club club, String name, String slug, String type, String surface, boolean indoor,
                  SportType sportType, int defaultPriceCents, Boolean published, Boolean active) {
        this.club = club;
        this.name = name;
        this.slug = slug;
        this.type = type;
        this.surface = surface;
        this.indoor = indoor;
        this.sportType = sportType != null ? sportType : SportType.PADEL;
        this.defaultPriceCents = defaultPriceCents;
        this.published = published == null || published;
        this.active = active == null || active;
    }

    public int defaultPriceFor(int durationMinutes) {
        return HourlyRate.prorate(defaultPriceCents, durationMinutes);
    }
}
