package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.HolidayDate;
import com.courtbook.court.domain.PriceRuleTarget;
import com.courtbook.court.domain.PriceRuleType;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.domain.TimeRanges;
import com.courtbook.court.dto.request.CreatePriceRuleRequest;
import com.courtbook.court.dto.request.UpdatePriceRuleRequest;
import com.courtbook.court.dto.response.PriceRuleResponse;
import com.courtbook.court.repository.CourtPriceRuleRepository;
import com.courtbook.court.repository.CourtRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PriceRuleService {

    private final CourtRepository courtRepository;
    private final CourtPriceRuleRepository priceRuleRepository;
    private final HolidayService holidayService;
    private final PriceRuleConflictDetector conflictDetector;

    @Transactional(readOnly = true)
    public List<PriceRuleResponse> getRules(Long courtId) {
        verifyCourtExists(courtId);

        List<CourtPriceRule> rules = priceRuleRepository.findByCourtId(courtId);
        Map<Long, HolidayDate> holidays = holidayService.findAllById(CourtPriceRule.holidayIdsOf(rules))
                .stream()
                .collect(Collectors.toMap(HolidayDate::getId, Function.identity()));

        return rules.stream()
                .sorted(CourtPriceRule.PRIORITY_ORDER)
                .map(rule -> PriceRuleResponse.of(rule, rule.getHolidayId() != null
                        ? holidays.get(rule.getHolidayId())
                        : null))
                .toList();
    }

    @Transactional
    public PriceRuleResponse createRule(Long courtId, CreatePriceRuleRequest request) {
        verifyCourtExists(courtId);

        PriceRuleType ruleType = parseRuleType(request.ruleType());
        TimeRange window = parseWindow(request.startTime(), request.endTime());
        int priceCents = validatePrice(request.priceCents());
        PriceRuleTarget target = PriceRuleTarget.of(ruleType, request.dayOfWeek(), request.date(), request.holidayId());
        HolidayDate holiday = target.holidayId() != null ? findHoliday(target.holidayId()) : null;

        conflictDetector.verifyNoConflict(courtId, target, window, null);

        CourtPriceRule rule = priceRuleRepository.save(CourtPriceRule.builder()
                .courtId(courtId)
                .target(target)
                .window(window)
                .priceCents(priceCents)
                .build());

        log.info("Created price rule id={} court={} type={} window={} price={}",
                rule.getId(), courtId, ruleType, window, priceCents);

        return PriceRuleResponse.of(rule, holiday);
    }

    /**
     * Fields absent from the request keep their stored value. When the rule type
     * changes, the stored type-specific field is dropped and the request must
     * supply the one the new type needs.
     */
    @Transactional
    public PriceRuleResponse updateRule(Long courtId, Long ruleId, UpdatePriceRuleRequest request) {
        CourtPriceRule rule = findRule(courtId, ruleId);

        PriceRuleType ruleType = request.ruleType() != null
                ? parseRuleType(request.ruleType())
                : rule.getRuleType();
        boolean typeChanged = ruleType != rule.getRuleType();

        Integer dayOfWeek = merge(request.dayOfWeek(), rule.getDayOfWeek(), typeChanged);
        LocalDate date = merge(request.date(), rule.getDate(), typeChanged);
        Long holidayId = merge(request.holidayId(), rule.getHolidayId(), typeChanged);

        TimeRange window = parseWindow(
                request.startTime() != null ? request.startTime() : rule.getStartTime(),
                request.endTime() != null ? request.endTime() : rule.getEndTime());
        int priceCents = validatePrice(request.priceCents() != null ? request.priceCents() : rule.getPriceCents());
        PriceRuleTarget target = PriceRuleTarget.of(ruleType, dayOfWeek, date, holidayId);

        HolidayDate holiday = null;
        if (target.holidayId() != null) {
            // an orphaned rule may keep its reference; a new reference must exist
            holiday = Objects.equals(target.holidayId(), rule.getHolidayId())
                    ? holidayService.findHoliday(target.holidayId()).orElse(null)
                    : findHoliday(target.holidayId());
        }

        conflictDetector.verifyNoConflict(courtId, target, window, rule.getId());

        rule.update(target, window, priceCents);

        log.info("Updated price rule id={} court={} type={} window={} price={}",
                ruleId, courtId, ruleType, window, priceCents);

        return PriceRuleResponse.of(rule, holiday);
    }

    @Transactional
    public void deleteRule(Long courtId, Long ruleId) {
        CourtPriceRule rule = findRule(courtId, ruleId);
        priceRuleRepository.delete(rule);

        log.info("Deleted price rule id={} court={}", ruleId, courtId);
    }

    private void verifyCourtExists(Long courtId) {
        if (!courtRepository.existsById(courtId)) {
            throw new BusinessException(ErrorCode.COURT_NOT_FOUND, "Court not found: " + courtId);
        }
    }

    private CourtPriceRule findRule(Long courtId, Long ruleId) {
        return priceRuleRepository.findById(ruleId)
                .filter(rule -> rule.belongsTo(courtId))
                .orElseThrow(() -> new BusinessException(ErrorCode.PRICE_RULE_NOT_FOUND,
                        "Price rule not found: " + ruleId));
    }

    private HolidayDate findHoliday(Long holidayId) {
        return holidayService.findHoliday(holidayId)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLIDAY_NOT_FOUND,
                        "Holiday not found: " + holidayId));
    }

    private static PriceRuleType parseRuleType(String value) {
        return PriceRuleType.parse(value)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_RULE_TYPE,
                        "Invalid ruleType. Must be one of: " + Arrays.stream(PriceRuleType.values())
                                .map(Enum::name)
                                .collect(Collectors.joining(", "))));
    }

    private static TimeRange parseWindow(String startTime, String endTime) {
        if (!TimeRanges.isValidTimeFormat(startTime) || !TimeRanges.isValidTimeFormat(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_RULE_TIME);
        }
        int start = TimeRanges.toMinutes(startTime);
        int end = TimeRanges.toMinutes(endTime);
        if (start >= end) {
            throw new BusinessException(ErrorCode.EMPTY_RULE_WINDOW);
        }
        return new TimeRange(start, end);
    }

    private static int validatePrice(Integer priceCents) {
        if (priceCents == null || priceCents < 0) {
            throw new BusinessException(ErrorCode.INVALID_RULE_PRICE);
        }
        return priceCents;
    }

    private static <T> T merge(T requested, T stored, boolean typeChanged) {
        if (requested != null) {
            return requested;
        }
        return typeChanged ? null : stored;
    }
}
