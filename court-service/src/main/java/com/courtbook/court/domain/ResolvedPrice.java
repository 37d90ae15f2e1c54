package com.courtbook.court.domain;

/**
 * Price of one slot on one court, with the rule that produced it
 * ({@code null} when the court's default rate applied).
 */
public record ResolvedPrice(int priceCents, CourtPriceRule rule) {

    public static ResolvedPrice fromRule(CourtPriceRule rule, TimeRange slot) {
        return new ResolvedPrice(HourlyRate.prorate(rule.getPriceCents(), slot.durationMinutes()), rule);
    }

    public static ResolvedPrice fromDefault(Court court, TimeRange slot) {
        return new ResolvedPrice(court.defaultPriceFor(slot.durationMinutes()), null);
    }

    public boolean isDefault() {
        return rule == null;
    }
}
