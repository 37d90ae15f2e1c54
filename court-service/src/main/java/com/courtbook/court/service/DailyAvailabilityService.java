package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.domain.Booking;
import com.courtbook.court.domain.BookingStatus;
import com.courtbook.court.domain.Club;
import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.CourtSlotStatus;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.response.DailyAvailabilityResponse;
import com.courtbook.court.dto.response.DailyAvailabilityResponse.CourtHourStatus;
import com.courtbook.court.dto.response.DailyAvailabilityResponse.CourtSummary;
import com.courtbook.court.dto.response.DailyAvailabilityResponse.HourSlot;
import com.courtbook.court.repository.BookingRepository;
import com.courtbook.court.repository.ClubRepository;
import com.courtbook.court.repository.CourtRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DailyAvailabilityService {

    private static final int HOUR = 60;

    private final ClubRepository clubRepository;
    private final CourtRepository courtRepository;
    private final BookingRepository bookingRepository;
    private final BusinessHoursResolver businessHoursResolver;
    private final AvailabilityProperties availabilityProperties;

    @Transactional(readOnly = true)
    public DailyAvailabilityResponse getDailyAvailability(Long clubId, LocalDate date) {
        Club club = clubRepository.findByIdWithBusinessHours(clubId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CLUB_NOT_FOUND,
                        "Club not found: " + clubId));

        List<Court> courts = courtRepository.findByClubIdAndActiveTrueOrderByIdAsc(clubId);
        List<CourtSummary> summaries = courts.stream().map(CourtSummary::from).toList();

        Optional<TimeRange> businessHours = businessHoursResolver.resolve(club, date);
        if (businessHours.isEmpty()) {
            return DailyAvailabilityResponse.closed(clubId, date, summaries);
        }
        TimeRange open = businessHours.get();

        Map<Long, List<Booking>> bookingsByCourt = findLiveBookings(courts, date, open);

        ZoneId zone = availabilityProperties.getZone();
        List<HourSlot> hours = new ArrayList<>();
        for (int start = open.startMinute(); start + HOUR <= open.endMinute(); start += HOUR) {
            TimeRange hour = new TimeRange(start, start + HOUR);
            Instant from = hour.startAt(date, zone);
            Instant to = hour.endAt(date, zone);

            List<CourtHourStatus> statuses = courts.stream()
                    .map(court -> new CourtHourStatus(court.getId(),
                            statusOf(bookingsByCourt.getOrDefault(court.getId(), List.of()), from, to)))
                    .toList();
            hours.add(HourSlot.of(hour.startTime(), hour.endTime(), statuses));
        }

        log.info("Daily availability club={} date={} hours={} courts={}", clubId, date, hours.size(), courts.size());

        return new DailyAvailabilityResponse(clubId, date, open.startTime(), open.endTime(), summaries, hours);
    }

    /**
     * Pending bookings win over confirmed ones; a confirmed booking books the
     * hour only when it covers all of it.
     */
    static CourtSlotStatus statusOf(List<Booking> bookings, Instant from, Instant to) {
        CourtSlotStatus status = CourtSlotStatus.AVAILABLE;
        for (Booking booking : bookings) {
            if (!booking.blocks(from, to)) {
                continue;
            }
            if (booking.getStatus() == BookingStatus.PENDING) {
                return CourtSlotStatus.PENDING;
            }
            if (booking.covers(from, to)) {
                status = CourtSlotStatus.BOOKED;
            } else if (status == CourtSlotStatus.AVAILABLE) {
                status = CourtSlotStatus.PARTIAL;
            }
        }
        return status;
    }

    private Map<Long, List<Booking>> findLiveBookings(List<Court> courts, LocalDate date, TimeRange open) {
        if (courts.isEmpty()) {
            return Map.of();
        }
        ZoneId zone = availabilityProperties.getZone();
        List<Long> courtIds = courts.stream().map(Court::getId).toList();

        return bookingRepository.findOverlapping(courtIds, open.startAt(date, zone), open.endAt(date, zone))
                .stream()
                .filter(booking -> booking.getStatus().isLive())
                .collect(Collectors.groupingBy(Booking::getCourtId));
    }
}
