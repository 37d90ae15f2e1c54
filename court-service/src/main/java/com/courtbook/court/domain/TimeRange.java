package com.courtbook.court.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Half-open {@code [start, end)} window of a day, in minutes since midnight.
 * The end may pass midnight for a requested slot; rule windows and business
 * hours always end within the day.
 */
public record TimeRange(int startMinute, int endMinute) {

    public static final TimeRange WHOLE_DAY = new TimeRange(0, TimeRanges.MINUTES_PER_DAY);

    public TimeRange {
        if (startMinute < 0 || endMinute <= startMinute) {
            throw new IllegalArgumentException(
                    "Invalid time range: " + startMinute + "-" + endMinute);
        }
    }

    public static TimeRange of(String startTime, String endTime) {
        return new TimeRange(TimeRanges.toMinutes(startTime), TimeRanges.toMinutes(endTime));
    }

    public static TimeRange startingAt(String startTime, int durationMinutes) {
        int start = TimeRanges.toMinutes(startTime);
        return new TimeRange(start, start + durationMinutes);
    }

    public String startTime() {
        return TimeRanges.formatMinutes(startMinute);
    }

    public String endTime() {
        return TimeRanges.formatMinutes(endMinute);
    }

    public int durationMinutes() {
        return endMinute - startMinute;
    }

    public boolean overlaps(TimeRange other) {
        return TimeRanges.overlaps(startMinute, endMinute, other.startMinute, other.endMinute);
    }

    public boolean contains(TimeRange other) {
        return startMinute <= other.startMinute && other.endMinute <= endMinute;
    }

    public Instant startAt(LocalDate date, ZoneId zone) {
        return toInstant(date, startMinute, zone);
    }

    public Instant endAt(LocalDate date, ZoneId zone) {
        return toInstant(date, endMinute, zone);
    }

    private static Instant toInstant(LocalDate date, int minuteOfDay, ZoneId zone) {
        return date.atStartOfDay().plusMinutes(minuteOfDay).atZone(zone).toInstant();
    }

    @Override
    public String toString() {
        return startTime() + "-" + endTime();
    }
}
