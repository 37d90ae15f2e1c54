package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.TestFixtures;
import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.PriceRuleTarget;
import com.courtbook.court.domain.PriceRuleType;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.request.CreatePriceRuleRequest;
import com.courtbook.court.dto.request.UpdatePriceRuleRequest;
import com.courtbook.court.dto.response.PriceRuleResponse;
import com.courtbook.court.repository.CourtPriceRuleRepository;
import com.courtbook.court.repository.CourtRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceRuleServiceTest {

    private static final Long COURT_ID = 10L;
    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 15);

    @Mock
    private CourtRepository courtRepository;
    @Mock
    private CourtPriceRuleRepository priceRuleRepository;
    @Mock
    private HolidayService holidayService;
    @Mock
    private PriceRuleConflictDetector conflictDetector;

    @InjectMocks
    private PriceRuleService priceRuleService;

    @Test
    void createRule_success_normalizesAndPersists() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);
        when(priceRuleRepository.save(any(CourtPriceRule.class))).thenAnswer(inv -> inv.getArgument(0));

        PriceRuleResponse response = priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("SPECIFIC_DAY", 6, null, null, "9:00", "12:00", 4000));

        assertThat(response.ruleType()).isEqualTo("SPECIFIC_DAY");
        assertThat(response.dayOfWeek()).isEqualTo(6);
        assertThat(response.startTime()).isEqualTo("09:00");
        assertThat(response.label()).isEqualTo("Every Saturday");
        assertThat(response.orphaned()).isFalse();
        verify(conflictDetector).verifyNoConflict(COURT_ID, new PriceRuleTarget.SpecificDay(DayOfWeek.SATURDAY),
                TimeRange.of("09:00", "12:00"), null);
    }

    @Test
    void createRule_unknownCourt_throwsNotFound() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(false);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("ALL_DAYS", null, null, null, "09:00", "12:00", 4000)))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.COURT_NOT_FOUND);
    }

    @Test
    void createRule_invalidRuleType_throwsException() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("EVERY_OTHER_DAY", null, null, null, "09:00", "12:00", 4000)))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_RULE_TYPE)
                .hasMessageContaining("SPECIFIC_DATE, HOLIDAY, SPECIFIC_DAY, WEEKDAYS, WEEKENDS, ALL_DAYS");
    }

    @Test
    void createRule_invalidTime_throwsException() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("ALL_DAYS", null, null, null, "09:00", "24:00", 4000)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_RULE_TIME);
    }

    @Test
    void createRule_zeroLengthWindow_rejectedBeforeConflictCheck() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("ALL_DAYS", null, null, null, "10:00", "10:00", 4000)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EMPTY_RULE_WINDOW);
        verifyNoInteractions(conflictDetector);
    }

    @Test
    void createRule_negativePrice_throwsException() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("ALL_DAYS", null, null, null, "09:00", "12:00", -1)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_RULE_PRICE);
    }

    @Test
    void createRule_missingTypeField_throwsException() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("SPECIFIC_DATE", null, null, null, "09:00", "12:00", 4000)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_RULE_TARGET);
    }

    @Test
    void createRule_unknownHoliday_throwsNotFound() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);
        when(holidayService.findHoliday(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("HOLIDAY", null, null, 5L, "09:00", "12:00", 4000)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.HOLIDAY_NOT_FOUND);
        verifyNoInteractions(conflictDetector);
    }

    @Test
    void createRule_holiday_labelsWithHolidayName() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);
        when(holidayService.findHoliday(5L))
                .thenReturn(Optional.of(TestFixtures.createHoliday(5L, "Founders Day", MONDAY)));
        when(priceRuleRepository.save(any(CourtPriceRule.class))).thenAnswer(inv -> inv.getArgument(0));

        PriceRuleResponse response = priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("HOLIDAY", null, null, 5L, "09:00", "12:00", 4000));

        assertThat(response.holidayName()).isEqualTo("Founders Day");
        assertThat(response.label()).isEqualTo("Holiday: Founders Day");
    }

    @Test
    void createRule_conflict_isNotPersisted() {
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);
        doThrow(new BusinessException(ErrorCode.PRICE_RULE_CONFLICT,
                "Time range conflicts with existing ALL_DAYS rule (08:00-22:00)"))
                .when(conflictDetector).verifyNoConflict(eq(COURT_ID), any(), any(), isNull());

        assertThatThrownBy(() -> priceRuleService.createRule(COURT_ID,
                new CreatePriceRuleRequest("WEEKDAYS", null, null, null, "18:00", "20:00", 4000)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_RULE_CONFLICT);
        verify(priceRuleRepository, never()).save(any());
    }

    @Test
    void getRules_flagsOrphanedHolidayRulesAndSortsByPriority() {
        CourtPriceRule allDays = TestFixtures.createRule(1L, COURT_ID, new PriceRuleTarget.AllDays(), "08:00", "22:00", 2000);
        CourtPriceRule orphan = TestFixtures.createRule(2L, COURT_ID, new PriceRuleTarget.Holiday(99L), "08:00", "22:00", 5000);
        CourtPriceRule date = TestFixtures.createRule(3L, COURT_ID, new PriceRuleTarget.SpecificDate(MONDAY), "18:00", "19:00", 2500);
        when(courtRepository.existsById(COURT_ID)).thenReturn(true);
        when(priceRuleRepository.findByCourtId(COURT_ID)).thenReturn(List.of(allDays, orphan, date));
        when(holidayService.findAllById(Set.of(99L))).thenReturn(List.of());

        List<PriceRuleResponse> rules = priceRuleService.getRules(COURT_ID);

        assertThat(rules).extracting(PriceRuleResponse::id).containsExactly(3L, 2L, 1L);
        assertThat(rules.get(0).label()).isEqualTo("2024-01-15");
        assertThat(rules.get(1).orphaned()).isTrue();
        assertThat(rules.get(1).label()).isEqualTo("Holiday (deleted)");
        assertThat(rules.get(2).orphaned()).isFalse();
        assertThat(rules.get(2).label()).isEqualTo("Every day");
    }

    @Test
    void updateRule_priceOnly_keepsOtherFields() {
        CourtPriceRule rule = TestFixtures.createRule(1L, COURT_ID, new PriceRuleTarget.Weekdays(), "17:00", "21:00", 2200);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));

        PriceRuleResponse response = priceRuleService.updateRule(COURT_ID, 1L,
                new UpdatePriceRuleRequest(null, null, null, null, null, null, 2400));

        assertThat(response.priceCents()).isEqualTo(2400);
        assertThat(response.ruleType()).isEqualTo("WEEKDAYS");
        assertThat(rule.getStartTime()).isEqualTo("17:00");
        verify(conflictDetector).verifyNoConflict(COURT_ID, new PriceRuleTarget.Weekdays(),
                TimeRange.of("17:00", "21:00"), 1L);
    }

    @Test
    void updateRule_changingType_dropsStoredTypeField() {
        CourtPriceRule rule = TestFixtures.createRule(1L, COURT_ID,
                new PriceRuleTarget.SpecificDay(DayOfWeek.SATURDAY), "09:00", "12:00", 4000);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));

        priceRuleService.updateRule(COURT_ID, 1L,
                new UpdatePriceRuleRequest("WEEKENDS", null, null, null, null, "13:00", null));

        assertThat(rule.getRuleType()).isEqualTo(PriceRuleType.WEEKENDS);
        assertThat(rule.getDayOfWeek()).isNull();
        assertThat(rule.getEndTime()).isEqualTo("13:00");
    }

    @Test
    void updateRule_changingTypeWithoutNewField_throwsException() {
        CourtPriceRule rule = TestFixtures.createRule(1L, COURT_ID, new PriceRuleTarget.Weekdays(), "09:00", "12:00", 4000);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));

        assertThatThrownBy(() -> priceRuleService.updateRule(COURT_ID, 1L,
                new UpdatePriceRuleRequest("SPECIFIC_DATE", null, null, null, null, null, null)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_RULE_TARGET);
        assertThat(rule.getRuleType()).isEqualTo(PriceRuleType.WEEKDAYS);
    }

    @Test
    void updateRule_orphanKeepsItsReference() {
        CourtPriceRule rule = TestFixtures.createRule(1L, COURT_ID, new PriceRuleTarget.Holiday(99L), "09:00", "12:00", 4000);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));
        when(holidayService.findHoliday(99L)).thenReturn(Optional.empty());

        PriceRuleResponse response = priceRuleService.updateRule(COURT_ID, 1L,
                new UpdatePriceRuleRequest(null, null, null, null, null, null, 4500));

        assertThat(response.orphaned()).isTrue();
        assertThat(response.priceCents()).isEqualTo(4500);
    }

    @Test
    void updateRule_ruleOfOtherCourt_throwsNotFound() {
        CourtPriceRule rule = TestFixtures.createRule(1L, 77L, new PriceRuleTarget.Weekdays(), "09:00", "12:00", 4000);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));

        assertThatThrownBy(() -> priceRuleService.updateRule(COURT_ID, 1L,
                new UpdatePriceRuleRequest(null, null, null, null, null, null, 4500)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_RULE_NOT_FOUND);
    }

    @Test
    void deleteRule_success() {
        CourtPriceRule rule = TestFixtures.createRule(1L, COURT_ID, new PriceRuleTarget.Weekdays(), "09:00", "12:00", 4000);
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.of(rule));

        priceRuleService.deleteRule(COURT_ID, 1L);

        verify(priceRuleRepository).delete(rule);
    }

    @Test
    void deleteRule_missing_throwsNotFound() {
        when(priceRuleRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> priceRuleService.deleteRule(COURT_ID, 1L))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_RULE_NOT_FOUND);
    }
}
