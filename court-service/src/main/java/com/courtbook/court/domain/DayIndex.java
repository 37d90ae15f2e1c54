package com.courtbook.court.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Converts between {@link DayOfWeek} and the stored 0-6 index (Sunday = 0).
 */
public final class DayIndex {

    private DayIndex() {
    }

    public static int of(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static int of(LocalDate date) {
        return of(date.getDayOfWeek());
    }

    public static boolean isValid(Integer index) {
        return index != null && index >= 0 && index <= 6;
    }

    public static DayOfWeek toDayOfWeek(int index) {
        if (index < 0 || index > 6) {
            throw new IllegalArgumentException("Day index must be between 0 and 6: " + index);
        }
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }
}
