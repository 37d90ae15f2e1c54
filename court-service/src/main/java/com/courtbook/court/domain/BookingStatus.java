package com.courtbook.court.domain;

public enum BookingStatus {
    PENDING,
    PAID,
    RESERVED,
    CONFIRMED,
    CANCELLED,
    NO_SHOW,
    COMPLETED;

    /**
     * Whether a booking in this status still occupies its slot.
     */
    public boolean isLive() {
        return this != CANCELLED && this != NO_SHOW;
    }
}
