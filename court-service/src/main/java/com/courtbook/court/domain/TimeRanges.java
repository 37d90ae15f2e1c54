package com.courtbook.court.domain;

import java.util.regex.Pattern;

/**
 * Operations on {@code HH:MM} wall-clock times and half-open intervals.
 * <p>
 * Callers validate with {@link #isValidTimeFormat(String)} before using the
 * other methods; they assume well-formed input.
 */
public final class TimeRanges {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]?[0-9]|2[0-3]):([0-5][0-9])$");

    private TimeRanges() {
    }

    public static boolean isValidTimeFormat(String time) {
        return time != null && TIME_PATTERN.matcher(time).matches();
    }

    /**
     * Zero-pads the hour, so {@code "9:05"} becomes {@code "09:05"}. Idempotent.
     */
    public static String normalizeTime(String time) {
        return formatMinutes(toMinutes(time));
    }

    public static int toMinutes(String time) {
        int colon = time.indexOf(':');
        int hours = Integer.parseInt(time.substring(0, colon));
        int minutes = Integer.parseInt(time.substring(colon + 1));
        return hours * 60 + minutes;
    }

    /**
     * Formats minutes since midnight. Values past midnight keep counting
     * hours ({@code 1470} is {@code "24:30"}) so a slot end stays readable.
     */
    public static String formatMinutes(int minutes) {
        if (minutes < 0) {
            throw new IllegalArgumentException("Minutes must not be negative: " + minutes);
        }
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    /**
     * Half-open overlap: touching intervals ({@code aEnd == bStart}) do not overlap.
     */
    public static boolean doTimesOverlap(String aStart, String aEnd, String bStart, String bEnd) {
        return overlaps(toMinutes(aStart), toMinutes(aEnd), toMinutes(bStart), toMinutes(bEnd));
    }

    public static <T extends Comparable<? super T>> boolean overlaps(T aStart, T aEnd, T bStart, T bEnd) {
        return aStart.compareTo(bEnd) < 0 && bStart.compareTo(aEnd) < 0;
    }
}
