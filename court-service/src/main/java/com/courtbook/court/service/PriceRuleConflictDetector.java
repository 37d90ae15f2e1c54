package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.config.PricingProperties;
import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.DayCoverage;
import com.courtbook.court.domain.HolidayCalendar;
import com.courtbook.court.domain.PriceRuleTarget;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.repository.CourtPriceRuleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds an existing rule of the same court that could fire on the same day
 * as a candidate rule with an overlapping window.
 * <p>
 * Day compatibility is decided by {@link DayCoverage#mayIntersect}; a rule whose
 * holiday cannot be resolved is assumed to fire on any day.
 */
@Component
@RequiredArgsConstructor
public class PriceRuleConflictDetector {

    private final CourtPriceRuleRepository priceRuleRepository;
    private final HolidayService holidayService;
    private final PricingProperties pricingProperties;

    /**
     * @param excludedRuleId rule being updated, skipped in the comparison; {@code null} on create
     */
    public Optional<CourtPriceRule> findConflictingRule(Long courtId, PriceRuleTarget target,
                                                        TimeRange window, Long excludedRuleId) {
        List<CourtPriceRule> existing = priceRuleRepository.findByCourtId(courtId)
                .stream()
                .filter(rule -> !Objects.equals(rule.getId(), excludedRuleId))
                .filter(rule -> !pricingProperties.isAllowTierOverrides()
                        || rule.getRuleType().sameTierAs(target.type()))
                .filter(rule -> rule.getWindow().overlaps(window))
                .sorted(CourtPriceRule.PRIORITY_ORDER)
                .toList();
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Set<Long> holidayIds = new HashSet<>(CourtPriceRule.holidayIdsOf(existing));
        if (target.holidayId() != null) {
            holidayIds.add(target.holidayId());
        }
        HolidayCalendar holidays = holidayService.calendarFor(holidayIds);
        DayCoverage candidate = target.coverage(holidays);

        return existing.stream()
                .filter(rule -> rule.getTarget().coverage(holidays).mayIntersect(candidate))
                .findFirst();
    }

    /**
     * @throws BusinessException {@code PRICE_RULE_CONFLICT} naming the conflicting rule's type and window
     */
    public void verifyNoConflict(Long courtId, PriceRuleTarget target, TimeRange window, Long excludedRuleId) {
        findConflictingRule(courtId, target, window, excludedRuleId).ifPresent(conflict -> {
            throw new BusinessException(ErrorCode.PRICE_RULE_CONFLICT,
                    "Time range conflicts with existing " + conflict.getRuleType()
                            + " rule (" + conflict.getStartTime() + "-" + conflict.getEndTime() + ")");
        });
    }
}
