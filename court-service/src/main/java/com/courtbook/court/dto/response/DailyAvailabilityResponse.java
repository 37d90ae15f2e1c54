package com.courtbook.court.dto.response;

import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.CourtSlotStatus;

import java.time.LocalDate;
import java.util.List;

public record DailyAvailabilityResponse(
        Long clubId,
        LocalDate date,
        String openTime,
        String closeTime,
        List<CourtSummary> courts,
        List<HourSlot> hours
) {
    public record CourtSummary(Long id, String name, String sportType) {

        public static CourtSummary from(Court court) {
            return new CourtSummary(court.getId(), court.getName(), court.getSportType().name());
        }
    }

    public record CourtHourStatus(Long courtId, CourtSlotStatus status) {}

    public record HourSlot(
            String start,
            String end,
            List<CourtHourStatus> courts,
            CourtSlotStatus overallStatus,
            long availableCount,
            long bookedCount,
            long partialCount,
            long pendingCount
    ) {
        public static HourSlot of(String start, String end, List<CourtHourStatus> courts) {
            return new HourSlot(start, end, courts, overallStatusOf(courts),
                    count(courts, CourtSlotStatus.AVAILABLE),
                    count(courts, CourtSlotStatus.BOOKED),
                    count(courts, CourtSlotStatus.PARTIAL),
                    count(courts, CourtSlotStatus.PENDING));
        }

        /**
         * A status shared by every court, otherwise PARTIAL.
         */
        private static CourtSlotStatus overallStatusOf(List<CourtHourStatus> courts) {
            for (CourtSlotStatus status : List.of(CourtSlotStatus.AVAILABLE, CourtSlotStatus.BOOKED,
                    CourtSlotStatus.PENDING)) {
                if (count(courts, status) == courts.size()) {
                    return status;
                }
            }
            return CourtSlotStatus.PARTIAL;
        }

        private static long count(List<CourtHourStatus> courts, CourtSlotStatus status) {
            return courts.stream().filter(court -> court.status() == status).count();
        }
    }

    public static DailyAvailabilityResponse closed(Long clubId, LocalDate date, List<CourtSummary> courts) {
        return new DailyAvailabilityResponse(clubId, date, null, null, courts, List.of());
    }
}
