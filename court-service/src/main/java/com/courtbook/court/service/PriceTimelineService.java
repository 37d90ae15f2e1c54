package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.domain.Court;
import com.courtbook.court.domain.CourtPriceRule;
import com.courtbook.court.domain.HolidayCalendar;
import com.courtbook.court.domain.TimeRange;
import com.courtbook.court.dto.response.PriceTimelineResponse;
import com.courtbook.court.dto.response.PriceTimelineResponse.PriceSegment;
import com.courtbook.court.repository.CourtPriceRuleRepository;
import com.courtbook.court.repository.CourtRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the priced segments of one court's day. Rules are laid down from the
 * most specific tier down; a broader rule only fills minutes still uncovered.
 * Minutes without any segment cost the court's default rate.
 */
@Service
@RequiredArgsConstructor
public class PriceTimelineService {

    private final CourtRepository courtRepository;
    private final CourtPriceRuleRepository priceRuleRepository;
    private final HolidayService holidayService;

    @Transactional(readOnly = true)
    public PriceTimelineResponse getTimeline(Long courtId, LocalDate date) {
        Court court = courtRepository.findById(courtId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURT_NOT_FOUND,
                        "Court not found: " + courtId));

        List<CourtPriceRule> rules = priceRuleRepository.findByCourtId(courtId);
        HolidayCalendar holidays = holidayService.calendarFor(CourtPriceRule.holidayIdsOf(rules));

        List<CourtPriceRule> matching = rules.stream()
                .filter(rule -> rule.getTarget().matches(date, holidays))
                .sorted(CourtPriceRule.PRIORITY_ORDER)
                .toList();

        List<TimeRange> covered = new ArrayList<>();
        List<Segment> segments = new ArrayList<>();
        for (CourtPriceRule rule : matching) {
            for (TimeRange gap : uncovered(rule.getWindow(), covered)) {
                segments.add(new Segment(gap, rule.getPriceCents()));
                covered.add(gap);
            }
        }
        segments.sort(Comparator.comparingInt(segment -> segment.range().startMinute()));

        return new PriceTimelineResponse(courtId, date, court.getDefaultPriceCents(), merge(segments));
    }

    static List<TimeRange> uncovered(TimeRange window, List<TimeRange> covered) {
        List<TimeRange> sorted = covered.stream()
                .sorted(Comparator.comparingInt(TimeRange::startMinute))
                .toList();

        List<TimeRange> gaps = new ArrayList<>();
        int current = window.startMinute();
        for (TimeRange range : sorted) {
            if (current >= window.endMinute()) {
                break;
            }
            if (range.endMinute() <= current) {
                continue;
            }
            if (range.startMinute() > current) {
                gaps.add(new TimeRange(current, Math.min(range.startMinute(), window.endMinute())));
            }
            current = Math.max(current, range.endMinute());
        }
        if (current < window.endMinute()) {
            gaps.add(new TimeRange(current, window.endMinute()));
        }
        return gaps;
    }

    private static List<PriceSegment> merge(List<Segment> segments) {
        List<PriceSegment> merged = new ArrayList<>();
        Segment current = null;
        for (Segment segment : segments) {
            if (current != null
                    && current.priceCents() == segment.priceCents()
                    && current.range().endMinute() == segment.range().startMinute()) {
                current = new Segment(
                        new TimeRange(current.range().startMinute(), segment.range().endMinute()),
                        current.priceCents());
                continue;
            }
            if (current != null) {
                merged.add(current.toResponse());
            }
            current = segment;
        }
        if (current != null) {
            merged.add(current.toResponse());
        }
        return merged;
    }

    private record Segment(TimeRange range, int priceCents) {

        PriceSegment toResponse() {
            return new PriceSegment(range.startTime(), range.endTime(), priceCents);
        }
    }
}
