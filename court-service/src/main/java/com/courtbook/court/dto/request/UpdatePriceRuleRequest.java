package com.courtbook.court.dto.request;

import java.time.LocalDate;

/**
 * Partial update; {@code null} fields keep their current value.
 */
public record UpdatePriceRuleRequest(
        String ruleType,
        Integer dayOfWeek,
        LocalDate date,
        Long holidayId,
        String startTime,
        String endTime,
        Integer priceCents
) {
}
