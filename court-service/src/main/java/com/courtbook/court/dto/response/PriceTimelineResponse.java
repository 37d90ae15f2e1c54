package com.courtbook.court.dto.response;

import java.time.LocalDate;
import java.util.List;

public record PriceTimelineResponse(
        Long courtId,
        LocalDate date,
        int defaultPriceCents,
        List<PriceSegment> segments
) {
    /** Hourly rate over {@code [start, end)}. */
    public record PriceSegment(String start, String end, int priceCents) {}
}
