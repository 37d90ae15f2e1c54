package com.courtbook.court.domain;

/**
 * State of one court during one hour of the daily grid.
 */
public enum CourtSlotStatus {
    AVAILABLE,
    BOOKED,
    PARTIAL,
    PENDING
}
