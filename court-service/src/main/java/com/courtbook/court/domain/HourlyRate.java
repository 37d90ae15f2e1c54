package com.courtbook.court.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices are stored as hourly rates in minor currency units.
 */
public final class HourlyRate {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private HourlyRate() {
    }

    /**
     * Scales an hourly rate to {@code durationMinutes}, rounding half-up to a whole minor unit.
     */
    public static int prorate(int hourlyCents, int durationMinutes) {
        return BigDecimal.valueOf(hourlyCents)
                .multiply(BigDecimal.valueOf(durationMinutes))
                .divide(MINUTES_PER_HOUR, 0, RoundingMode.HALF_UP)
                .intValueExact();
    }
}
