package com.courtbook.court.domain;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of holiday dates keyed by holiday id. A missing id means the
 * holiday was deleted and rules referring to it are orphans.
 */
public final class HolidayCalendar {

    private static final HolidayCalendar EMPTY = new HolidayCalendar(Map.of());

    private final Map<Long, LocalDate> datesById;

    private HolidayCalendar(Map<Long, LocalDate> datesById) {
        this.datesById = datesById;
    }

    public static HolidayCalendar empty() {
        return EMPTY;
    }

    public static HolidayCalendar of(Collection<HolidayDate> holidays) {
        Map<Long, LocalDate> dates = new HashMap<>();
        for (HolidayDate holiday : holidays) {
            dates.put(holiday.getId(), holiday.getDate());
        }
        return new HolidayCalendar(dates);
    }

    public Optional<LocalDate> dateOf(Long holidayId) {
        return Optional.ofNullable(datesById.get(holidayId));
    }

    public boolean contains(Long holidayId) {
        return datesById.containsKey(holidayId);
    }
}
