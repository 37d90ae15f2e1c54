package com.courtbook.court.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rule types with their resolution rank; a lower rank is more specific and wins.
 */
@Getter
@RequiredArgsConstructor
public enum PriceRuleType {

    SPECIFIC_DATE(1),
    HOLIDAY(2),
    SPECIFIC_DAY(3),
    WEEKDAYS(4),
    WEEKENDS(4),
    ALL_DAYS(5);

    private final int rank;

    public boolean sameTierAs(PriceRuleType other) {
        return rank == other.rank;
    }

    public static Optional<PriceRuleType> parse(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst();
    }
}
