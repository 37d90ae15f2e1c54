package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.HolidayCalendar;
import com.courtbook.court.domain.ResolvedPrice;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.response.SlotPriceResponse;
import com.courtbook.court.repository.CourtPriceRuleRepository;
import com.courtbook.court.repository.CourtRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Picks the single price rule that applies to a slot. A rule applies when it
 * fires on the date and its window contains the whole slot; among those the
 * most specific tier wins. Without one the court's default rate applies.
 */
@Service
@RequiredArgsConstructor
public class PriceResolver {

    private final CourtRepository courtRepository;
    private final CourtPriceRuleRepository priceRuleRepository;
    private final HolidayService holidayService;

    @Transactional(readOnly = true)
    public SlotPriceResponse resolvePrice(Long courtId, LocalDate date, TimeRange slot) {
        Court court = courtRepository.findById(courtId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURT_NOT_FOUND,
                        "Court not found: " + courtId));

        return SlotPriceResponse.of(court, date, slot, resolve(court, date, slot));
    }

    @Transactional(readOnly = true)
    public ResolvedPrice resolve(Court court, LocalDate date, TimeRange slot) {
        List<CourtPriceRule> rules = priceRuleRepository.findByCourtId(court.getId());
        HolidayCalendar holidays = holidayService.calendarFor(CourtPriceRule.holidayIdsOf(rules));

        return rules.stream()
                .filter(rule -> rule.getTarget().matches(date, holidays))
                .filter(rule -> rule.getWindow().contains(slot))
                .min(CourtPriceRule.PRIORITY_ORDER)
                .map(rule -> ResolvedPrice.fromRule(rule, slot))
                .orElseGet(() -> ResolvedPrice.fromDefault(court, slot));
    }
}
