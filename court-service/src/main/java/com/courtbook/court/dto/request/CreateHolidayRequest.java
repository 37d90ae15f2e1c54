package com.courtbook.court.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateHolidayRequest(
        @NotBlank @Size(max = 100) String name,
        @NotNull LocalDate date
) {
}
