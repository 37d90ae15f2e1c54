package com.courtbook.court.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record CreatePriceRuleRequest(
        @NotBlank String ruleType,
        Integer dayOfWeek,
        LocalDate date,
        Long holidayId,
        @NotBlank String startTime,
        @NotBlank String endTime,
        @NotNull Integer priceCents
) {
}
