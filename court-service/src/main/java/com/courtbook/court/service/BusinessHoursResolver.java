package com.courtbook.court.service;

import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.domain.Club;
import com.courtbook.court.domain.ClubBusinessHours;
import com.courtbook.court.domain.ClubSpecialHours;
import com.courtbook.court.domain.DayIndex;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.repository.ClubSpecialHoursRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves a club's bookable hours for one date: special hours for the date,
 * then the weekly schedule, then the configured default. Empty means closed.
 */
@Component
@RequiredArgsConstructor
public class BusinessHoursResolver {

    private final ClubSpecialHoursRepository specialHoursRepository;
    private final AvailabilityProperties availabilityProperties;

    public Optional<TimeRange> resolve(Club club, LocalDate date) {
        Optional<ClubSpecialHours> special = specialHoursRepository.findByClubIdAndDate(club.getId(), date);
        if (special.isPresent()) {
            if (special.get().isClosed()) {
                return Optional.empty();
            }
            if (special.get().hasHours()) {
                return Optional.of(special.get().toTimeRange());
            }
        }

        Optional<ClubBusinessHours> weekly = club.businessHoursOn(DayIndex.of(date));
        if (weekly.isPresent()) {
            if (weekly.get().isClosed()) {
                return Optional.empty();
            }
            if (weekly.get().hasHours()) {
                return Optional.of(weekly.get().toTimeRange());
            }
        }

        return Optional.of(availabilityProperties.defaultBusinessHours());
    }
}
