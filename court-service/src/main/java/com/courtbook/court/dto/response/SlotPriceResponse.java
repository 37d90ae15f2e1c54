package com.courtbook.court.dto.response;

import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.ResolvedPrice;
import com.courtbook.court.domain.TimeRange;

import java.time.LocalDate;

public record SlotPriceResponse(
        Long courtId,
        LocalDate date,
        String startTime,
        String endTime,
        int durationMinutes,
        int priceCents,
        int defaultPriceCents,
        Long ruleId,
        String ruleType
) {
    public static SlotPriceResponse of(Court court, LocalDate date, TimeRange slot, ResolvedPrice price) {
        return new SlotPriceResponse(
                court.getId(),
                date,
                slot.startTime(),
                slot.endTime(),
                slot.durationMinutes(),
                price.priceCents(),
                court.getDefaultPriceCents(),
                price.isDefault() ? null : price.rule().getId(),
                price.isDefault() ? null : price.rule().getRuleType().name()
        );
    }
}
