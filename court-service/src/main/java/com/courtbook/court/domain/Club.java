package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "clubs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Club extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100, unique = true)
    private String slug;

    @OneToMany(mappedBy = "club", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ClubBusinessHours> businessHours = new ArrayList<>();

    @Builder
    private Club(String name, String slug) {
        this.name = name;
        this.slug = slug;
    }

    public void addBusinessHours(ClubBusinessHours hours) {
        businessHours.add(hours);
    }

    public Optional<ClubBusinessHours> businessHoursOn(int dayIndex) {
        return businessHours.stream()
                .filter(hours -> hours.getDayOfWeek() == dayIndex)
                .findFirst();
    }
}
