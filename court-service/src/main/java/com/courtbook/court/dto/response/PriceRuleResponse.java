package com.courtbook.court.dto.response;

import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.DayIndex;
import com.courtbook.court.domain.HolidayDate;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

public record PriceRuleResponse(
        Long id,
        Long courtId,
        String ruleType,
        Integer dayOfWeek,
        LocalDate date,
        Long holidayId,
        String holidayName,
        String startTime,
        String endTime,
        int priceCents,
        String label,
        boolean orphaned
) {
    private static final String DELETED_HOLIDAY_LABEL = "Holiday (deleted)";

    /**
     * @param holiday the referenced holiday, or {@code null} when the rule is not a
     *                HOLIDAY rule or its holiday no longer exists
     */
    public static PriceRuleResponse of(CourtPriceRule rule, HolidayDate holiday) {
        boolean orphaned = rule.getHolidayId() != null && holiday == null;
        return new PriceRuleResponse(
                rule.getId(),
                rule.getCourtId(),
                rule.getRuleType().name(),
                rule.getDayOfWeek(),
                rule.getDate(),
                rule.getHolidayId(),
                holiday != null ? holiday.getName() : null,
                rule.getStartTime(),
                rule.getEndTime(),
                rule.getPriceCents(),
                labelOf(rule, holiday),
                orphaned
        );
    }

    private static String labelOf(CourtPriceRule rule, HolidayDate holiday) {
        switch (rule.getRuleType()) {
            case SPECIFIC_DATE:
                return rule.getDate().toString();
            case SPECIFIC_DAY:
                return "Every " + DayIndex.toDayOfWeek(rule.getDayOfWeek())
                        .getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            case WEEKDAYS:
                return "Weekdays (Mon-Fri)";
            case WEEKENDS:
                return "Weekends (Sat-Sun)";
            case HOLIDAY:
                return holiday != null ? "Holiday: " + holiday.getName() : DELETED_HOLIDAY_LABEL;
            default:
                return "Every day";
        }
    }
}
