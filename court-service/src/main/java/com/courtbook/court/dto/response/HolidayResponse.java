package com.courtbook.court.dto.response;

import com.courtbook.court.domain.HolidayDate;

import java.time.LocalDate;

public record HolidayResponse(Long id, String name, LocalDate date) {

    public static HolidayResponse from(HolidayDate holiday) {
        return new HolidayResponse(holiday.getId(), holiday.getName(), holiday.getDate());
    }
}
