package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.domain.Booking;
import com.courtbook.court.domain.Club;
import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.SportType;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.request.SlotQuery;
import com.courtbook.court.dto.response.AvailableCourtResponse;
import com.courtbook.court.dto.response.AvailableCourtsResponse;
import com.courtbook.court.repository.BookingRepository;
import com.courtbook.court.repository.ClubRepository;
import com.courtbook.court.repository.CourtRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes which courts of a club are free for a slot and what each would charge.
 * The result is a snapshot; nothing is reserved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final ClubRepository clubRepository;
    private final CourtRepository courtRepository;
    private final BookingRepository bookingRepository;
    private final BusinessHoursResolver businessHoursResolver;
    private final PriceResolver priceResolver;
    private final AvailabilityProperties availabilityProperties;

    /**
     * Runs outside a transaction: each price lookup opens its own read-only one, so a
     * failed lookup rolls back only itself and the court falls back to its default rate.
     *
     * @param sportType optional filter; {@code null} keeps every sport
     */
    public AvailableCourtsResponse findAvailableCourts(Long clubId, SlotQuery query, SportType sportType) {
        Club club = clubRepository.findByIdWithBusinessHours(clubId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CLUB_NOT_FOUND,
                        "Club not found: " + clubId));

        LocalDate date = query.date();
        TimeRange slot = query.slot();

        Optional<TimeRange> businessHours = businessHoursResolver.resolve(club, date);
        if (businessHours.isEmpty() || !businessHours.get().contains(slot)) {
            log.info("Slot {} {} outside business hours {} for club={}",
                    date, slot, businessHours.map(TimeRange::toString).orElse("closed"), clubId);
            return AvailableCourtsResponse.empty();
        }

        List<Court> courts = courtRepository.findByClubIdAndActiveTrueOrderByIdAsc(clubId)
                .stream()
                .filter(Court::isPublished)
                .filter(court -> sportType == null || court.getSportType() == sportType)
                .toList();
        if (courts.isEmpty()) {
            return AvailableCourtsResponse.empty();
        }

        ZoneId zone = availabilityProperties.getZone();
        Instant slotStart = slot.startAt(date, zone);
        Instant slotEnd = slot.endAt(date, zone);
        Set<Long> blockedCourtIds = findBookingsOfDay(courts, date, slotEnd).stream()
                .filter(booking -> booking.blocks(slotStart, slotEnd))
                .map(Booking::getCourtId)
                .collect(Collectors.toSet());

        List<AvailableCourtResponse> available = courts.stream()
                .filter(court -> !blockedCourtIds.contains(court.getId()))
                .map(court -> AvailableCourtResponse.of(court, priceOf(court, date, slot)))
                .toList();

        log.info("Availability club={} date={} slot={}: {}/{} courts free",
                clubId, date, slot, available.size(), courts.size());

        return new AvailableCourtsResponse(available);
    }

    /**
     * Bookings of the courts from the start of the day until the later of the
     * next midnight and the slot end.
     */
    private List<Booking> findBookingsOfDay(List<Court> courts, LocalDate date, Instant slotEnd) {
        ZoneId zone = availabilityProperties.getZone();
        Instant dayStart = TimeRange.WHOLE_DAY.startAt(date, zone);
        Instant dayEnd = TimeRange.WHOLE_DAY.endAt(date, zone);
        List<Long> courtIds = courts.stream().map(Court::getId).toList();

        return bookingRepository.findOverlapping(courtIds, dayStart, slotEnd.isAfter(dayEnd) ? slotEnd : dayEnd);
    }

    private int priceOf(Court court, LocalDate date, TimeRange slot) {
        try {
            return priceResolver.resolve(court, date, slot).priceCents();
        } catch (RuntimeException e) {
            log.warn("Price resolution failed for court={} date={} slot={}, using default price: {}",
                    court.getId(), date, slot, e.getMessage());
            return court.defaultPriceFor(slot.durationMinutes());
        }
    }
}
