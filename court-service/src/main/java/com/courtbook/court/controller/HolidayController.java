package com.courtbook.court.controller;

import com.courtbook.common.response.ApiResponse;
import com.courtbook.court.dto.request.CreateHolidayRequest;
import com.courtbook.court.dto.response.HolidayResponse;
import com.courtbook.court.service.HolidayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Holiday", description = "Holiday calendar referenced by HOLIDAY price rules")
@RestController
@RequestMapping("/api/v1/holidays")
@RequiredArgsConstructor
public class HolidayController {

    private final HolidayService holidayService;

    @Operation(summary = "List holidays")
    @GetMapping
    public ApiResponse<List<HolidayResponse>> getHolidays() {
        return ApiResponse.ok(holidayService.getHolidays());
    }

    @Operation(summary = "Create holiday")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<HolidayResponse> createHoliday(@Valid @RequestBody CreateHolidayRequest request) {
        return ApiResponse.ok(holidayService.createHoliday(request));
    }

    @Operation(summary = "Delete holiday", description = "Rules referring to the holiday stay and are flagged as orphaned")
    @DeleteMapping("/{holidayId}")
    public ApiResponse<Void> deleteHoliday(@PathVariable Long holidayId) {
        holidayService.deleteHoliday(holidayId);
        return ApiResponse.ok();
    }
}
