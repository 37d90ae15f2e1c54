package com.courtbook.court.domain;

import com.courtbook.common.domain.BaseTimeEntity;
import com.courtbook.common.exception.BusinessException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hourly price applied to a court over a daily window. Stored flat, but set
 * and read through {@link PriceRuleTarget}.
 */
@Entity
@Table(name = "court_price_rules", indexes = @Index(name = "idx_price_rules_court", columnList = "court_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourtPriceRule extends BaseTimeEntity {

    /** Most specific tier first, then earlier window, then older rule. */
    public static final Comparator<CourtPriceRule> PRIORITY_ORDER =
            Comparator.comparingInt((CourtPriceRule rule) -> rule.getRuleType().getRank())
                    .thenComparingInt(rule -> TimeRanges.toMinutes(rule.getStartTime()))
                    .thenComparing(CourtPriceRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "court_id", nullable = false)
    private Long courtId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PriceRuleType ruleType;

    private Integer dayOfWeek;

    @Column(name = "rule_date")
    private LocalDate date;

    private Long holidayId;

    @Column(nullable = false, length = 5)
    private String startTime;

    @Column(nullable = false, length = 5)
    private String endTime;

    @Column(nullable = false)
    private int priceCents;

    @Builder
    private CourtPriceRule(Long courtId, PriceRuleTarget target, TimeRange window, int priceCents) {
        this.courtId = courtId;
        applyTarget(target);
        applyWindow(window);
        this.priceCents = priceCents;
    }

    public void update(PriceRuleTarget target, TimeRange window, int priceCents) {
        applyTarget(target);
        applyWindow(window);
        this.priceCents = priceCents;
    }

    /**
     * @throws IllegalStateException if the stored columns do not form a valid target
     */
    public PriceRuleTarget getTarget() {
        try {
            return PriceRuleTarget.of(ruleType, dayOfWeek, date, holidayId);
        } catch (BusinessException e) {
            throw new IllegalStateException("Corrupt price rule id=" + id + ": " + e.getMessage(), e);
        }
    }

    public TimeRange getWindow() {
        return TimeRange.of(startTime, endTime);
    }

    public static Set<Long> holidayIdsOf(Collection<CourtPriceRule> rules) {
        return rules.stream()
                .map(CourtPriceRule::getHolidayId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    public boolean belongsTo(Long courtId) {
        return this.courtId.equals(courtId);
    }

    private void applyTarget(PriceRuleTarget target) {
        this.ruleType = target.type();
        this.dayOfWeek = target.dayOfWeek();
        this.date = target.date();
        this.holidayId = target.holidayId();
    }

    private void applyWindow(TimeRange window) {
        this.startTime = window.startTime();
        this.endTime = window.endTime();
    }
}
