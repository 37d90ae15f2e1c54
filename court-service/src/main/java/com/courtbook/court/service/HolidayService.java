package com.courtbook.court.service;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;
import com.courtbook.court.domain.HolidayCalendar;
import com.courtbook.court.domain.HolidayDate;
import com.courtbook.court.dto.request.CreateHolidayRequest;
import com.courtbook.court.dto.response.HolidayResponse;
import com.courtbook.court.repository.HolidayDateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayService {

    private final HolidayDateRepository holidayDateRepository;

    @Transactional(readOnly = true)
    public List<HolidayResponse> getHolidays() {
        return holidayDateRepository.findAllByOrderByDateAsc()
                .stream()
                .map(HolidayResponse::from)
                .toList();
    }

    @Transactional
    public HolidayResponse createHoliday(CreateHolidayRequest request) {
        HolidayDate holiday = holidayDateRepository.save(HolidayDate.builder()
                .name(request.name())
                .date(request.date())
                .build());

        log.info("Created holiday id={} name={} date={}", holiday.getId(), holiday.getName(), holiday.getDate());

        return HolidayResponse.from(holiday);
    }

    /**
     * Price rules pointing at the deleted holiday are kept and become orphans.
     */
    @Transactional
    public void deleteHoliday(Long holidayId) {
        HolidayDate holiday = holidayDateRepository.findById(holidayId)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLIDAY_NOT_FOUND,
                        "Holiday not found: " + holidayId));

        holidayDateRepository.delete(holiday);

        log.info("Deleted holiday id={} name={}", holidayId, holiday.getName());
    }

    @Transactional(readOnly = true)
    public Optional<HolidayDate> findHoliday(Long holidayId) {
        return holidayDateRepository.findById(holidayId);
    }

    @Transactional(readOnly = true)
    public List<HolidayDate> findAllById(Collection<Long> holidayIds) {
        if (holidayIds.isEmpty()) {
            return List.of();
        }
        return holidayDateRepository.findAllById(holidayIds);
    }

    @Transactional(readOnly = true)
    public HolidayCalendar calendarFor(Collection<Long> holidayIds) {
        if (holidayIds.isEmpty()) {
            return HolidayCalendar.empty();
        }
        return HolidayCalendar.of(holidayDateRepository.findAllById(holidayIds));
    }
}
