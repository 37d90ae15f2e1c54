package com.courtbook.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    INTERNAL_ERROR(500, "C002", "Internal server error"),

    // Slot query
    MISSING_DATE(400, "S001", "Missing required parameter: date"),
    MISSING_START_TIME(400, "S002", "Missing required parameter: start (or from)"),
    INVALID_DATE_FORMAT(400, "S003", "Invalid date format. Use YYYY-MM-DD"),
    INVALID_TIME_FORMAT(400, "S004", "Invalid start time format. Use HH:MM"),
    INVALID_END_TIME(400, "S005", "Invalid end time format. Use HH:MM"),
    END_BEFORE_START(400, "S006", "End time must be after start time"),
    INVALID_DURATION(400, "S007", "Invalid duration. Must be a positive integer"),
    INVALID_SPORT_TYPE(400, "S008", "Invalid sport type"),

    // Club / Court
    CLUB_NOT_FOUND(404, "K001", "Club not found"),
    COURT_NOT_FOUND(404, "K002", "Court not found"),

    // Holiday
    HOLIDAY_NOT_FOUND(404, "H001", "Holiday not found"),

    // Price rule
    PRICE_RULE_NOT_FOUND(404, "R001", "Price rule not found"),
    INVALID_RULE_TYPE(400, "R002", "Invalid ruleType"),
    INVALID_RULE_TIME(400, "R003", "Invalid time format. Use HH:MM format (00:00-23:59)"),
    EMPTY_RULE_WINDOW(400, "R004", "startTime must be before endTime"),
    INVALID_RULE_TARGET(400, "R005", "Invalid rule target"),
    INVALID_RULE_PRICE(400, "R006", "priceCents must be a non-negative number"),
    PRICE_RULE_CONFLICT(409, "R007", "Time range conflicts with an existing rule");

    private final int status;
    private final String code;
    private final String message;
}
