package com.courtbook.court.domain;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Objects;

/**
 * Which days a price rule applies to. Each variant carries only the field its
 * rule type needs, so a rule can never hold a date and a weekday at once.
 */
public interface PriceRuleTarget {

    PriceRuleType type();

    DayCoverage coverage(HolidayCalendar holidays);

    default boolean matches(LocalDate date, HolidayCalendar holidays) {
        return coverage(holidays).includes(date);
    }

    default Integer dayOfWeek() {
        return null;
    }

    default LocalDate date() {
        return null;
    }

    default Long holidayId() {
        return null;
    }

    /**
     * Builds the variant for {@code type} from flat fields. The field the type
     * needs must be present and the fields of other types must be absent.
     */
    static PriceRuleTarget of(PriceRuleType type, Integer dayOfWeek, LocalDate date, Long holidayId) {
        switch (type) {
            case SPECIFIC_DATE:
                requireAbsent(type, dayOfWeek == null && holidayId == null);
                if (date == null) {
                    throw new BusinessException(ErrorCode.INVALID_RULE_TARGET,
                            "date is required for SPECIFIC_DATE rules");
                }
                return new SpecificDate(date);
            case SPECIFIC_DAY:
                requireAbsent(type, date == null && holidayId == null);
                if (dayOfWeek == null) {
                    throw new BusinessException(ErrorCode.INVALID_RULE_TARGET,
                            "dayOfWeek is required for SPECIFIC_DAY rules");
                }
                if (!DayIndex.isValid(dayOfWeek)) {
                    throw new BusinessException(ErrorCode.INVALID_RULE_TARGET,
                            "dayOfWeek must be a number between 0 (Sunday) and 6 (Saturday)");
                }
                return new SpecificDay(DayIndex.toDayOfWeek(dayOfWeek));
            case HOLIDAY:
                requireAbsent(type, dayOfWeek == null && date == null);
                if (holidayId == null) {
                    throw new BusinessException(ErrorCode.INVALID_RULE_TARGET,
                            "holidayId is required for HOLIDAY rules");
                }
                return new Holiday(holidayId);
            case WEEKDAYS:
                requireAbsent(type, dayOfWeek == null && date == null && holidayId == null);
                return new Weekdays();
            case WEEKENDS:
                requireAbsent(type, dayOfWeek == null && date == null && holidayId == null);
                return new Weekends();
            case ALL_DAYS:
                requireAbsent(type, dayOfWeek == null && date == null && holidayId == null);
                return new AllDays();
            default:
                throw new BusinessException(ErrorCode.INVALID_RULE_TYPE, "Unsupported ruleType: " + type);
        }
    }

    private static void requireAbsent(PriceRuleType type, boolean otherFieldsAbsent) {
        if (!otherFieldsAbsent) {
            throw new BusinessException(ErrorCode.INVALID_RULE_TARGET,
                    "Only the field matching ruleType may be set for " + type + " rules");
        }
    }

    record SpecificDate(LocalDate date) implements PriceRuleTarget {

        public SpecificDate {
            Objects.requireNonNull(date, "date");
        }

        @Override
        public PriceRuleType type() {
            return PriceRuleType.SPECIFIC_DATE;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return DayCoverage.onDate(date);
        }
    }

    record SpecificDay(DayOfWeek day) implements PriceRuleTarget {

        public SpecificDay {
            Objects.requireNonNull(day, "day");
        }

        @Override
        public PriceRuleType type() {
            return PriceRuleType.SPECIFIC_DAY;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return DayCoverage.onDays(EnumSet.of(day));
        }

        @Override
        public Integer dayOfWeek() {
            return DayIndex.of(day);
        }
    }

    record Weekdays() implements PriceRuleTarget {

        @Override
        public PriceRuleType type() {
            return PriceRuleType.WEEKDAYS;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return DayCoverage.onDays(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
        }
    }

    record Weekends() implements PriceRuleTarget {

        @Override
        public PriceRuleType type() {
            return PriceRuleType.WEEKENDS;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return DayCoverage.onDays(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
        }
    }

    record AllDays() implements PriceRuleTarget {

        @Override
        public PriceRuleType type() {
            return PriceRuleType.ALL_DAYS;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return DayCoverage.onDays(EnumSet.allOf(DayOfWeek.class));
        }
    }

    record Holiday(Long holidayId) implements PriceRuleTarget {

        public Holiday {
            Objects.requireNonNull(holidayId, "holidayId");
        }

        @Override
        public PriceRuleType type() {
            return PriceRuleType.HOLIDAY;
        }

        @Override
        public DayCoverage coverage(HolidayCalendar holidays) {
            return holidays.dateOf(holidayId)
                    .map(DayCoverage::onDate)
                    .orElse(DayCoverage.unknown());
        }
    }
}
