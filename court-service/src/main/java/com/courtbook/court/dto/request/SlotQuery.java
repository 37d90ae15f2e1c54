package com.courtbook.court.dto.request;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.domain.TimeRanges;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * A validated slot request: one calendar date and a {@code [start, start + duration)} window.
 * <p>
 * Raw query parameters are checked in a fixed order so each failure maps to its own error code:
 * missing date, missing start, date format, start format, end format, end before start, duration.
 * A duration is at most one day long.
 */
public record SlotQuery(LocalDate date, TimeRange slot) {

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    public static SlotQuery parse(String date, String start, String duration, String to,
                                  int defaultDurationMinutes) {
        if (isBlank(date)) {
            throw new BusinessException(ErrorCode.MISSING_DATE);
        }
        if (isBlank(start)) {
            throw new BusinessException(ErrorCode.MISSING_START_TIME);
        }
        LocalDate parsedDate = parseDate(date);
        if (!TimeRanges.isValidTimeFormat(start)) {
            throw new BusinessException(ErrorCode.INVALID_TIME_FORMAT);
        }

        int durationMinutes;
        if (!isBlank(to)) {
            if (!TimeRanges.isValidTimeFormat(to)) {
                throw new BusinessException(ErrorCode.INVALID_END_TIME);
            }
            durationMinutes = TimeRanges.toMinutes(to) - TimeRanges.toMinutes(start);
            if (durationMinutes <= 0) {
                throw new BusinessException(ErrorCode.END_BEFORE_START);
            }
        } else {
            durationMinutes = isBlank(duration) ? defaultDurationMinutes : parseDuration(duration);
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_DURATION);
        }
        if (durationMinutes > TimeRanges.MINUTES_PER_DAY) {
            throw new BusinessException(ErrorCode.INVALID_DURATION,
                    "Invalid duration. Must not exceed " + TimeRanges.MINUTES_PER_DAY + " minutes");
        }

        return new SlotQuery(parsedDate, TimeRange.startingAt(start, durationMinutes));
    }

    /**
     * @throws BusinessException {@code MISSING_DATE} or {@code INVALID_DATE_FORMAT}
     */
    public static LocalDate parseDate(String date) {
        if (isBlank(date)) {
            throw new BusinessException(ErrorCode.MISSING_DATE);
        }
        if (!DATE_PATTERN.matcher(date).matches()) {
            throw new BusinessException(ErrorCode.INVALID_DATE_FORMAT);
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new BusinessException(ErrorCode.INVALID_DATE_FORMAT);
        }
    }

    private static int parseDuration(String duration) {
        try {
            return Integer.parseInt(duration.trim());
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.INVALID_DURATION);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
