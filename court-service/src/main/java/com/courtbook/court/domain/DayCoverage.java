package com.courtbook.court.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * The calendar days a price rule can fire on: one fixed date, a set of
 * weekdays, or unknown (a rule pointing at a deleted holiday).
 */
public final class DayCoverage {

    private static final DayCoverage UNKNOWN = new DayCoverage(null, null);

    private final LocalDate date;
    private final Set<DayOfWeek> days;

    private DayCoverage(LocalDate date, Set<DayOfWeek> days) {
        this.date = date;
        this.days = days;
    }

    public static DayCoverage onDate(LocalDate date) {
        return new DayCoverage(date, null);
    }

    public static DayCoverage onDays(Set<DayOfWeek> days) {
        return new DayCoverage(null, EnumSet.copyOf(days));
    }

    public static DayCoverage unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return date == null && days == null;
    }

    /**
     * Unknown coverage includes no date.
     */
    public boolean includes(LocalDate candidate) {
        if (date != null) {
            return date.equals(candidate);
        }
        return days != null && days.contains(candidate.getDayOfWeek());
    }

    /**
     * Unknown coverage may intersect anything.
     */
    public boolean mayIntersect(DayCoverage other) {
        if (isUnknown() || other.isUnknown()) {
            return true;
        }
        if (date != null) {
            return other.includes(date);
        }
        if (other.date != null) {
            return includes(other.date);
        }
        return days.stream().anyMatch(other.days::contains);
    }
}
