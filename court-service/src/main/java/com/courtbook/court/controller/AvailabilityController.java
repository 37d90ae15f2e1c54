package com.courtbook.court.controller;

import com.courtbook.common.response.ApiResponse;
import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.domain.SportType;
import com.courtbook.court.dto.request.SlotQuery;
import com.courtbook.court.dto.response.AvailableCourtsResponse;
import com.courtbook.court.dto.response.DailyAvailabilityResponse;
import com.courtbook.court.service.AvailabilityService;
import com.courtbook.court.service.DailyAvailabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Availability", description = "Free courts and daily occupancy of a club")
@RestController
@RequestMapping("/api/v1/clubs/{clubId}")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;
    private final DailyAvailabilityService dailyAvailabilityService;
    private final AvailabilityProperties availabilityProperties;

    @Operation(summary = "Find available courts",
            description = "Courts free for [start, start + duration) on a date, each with its resolved price. "
                    + "Either duration or an end time (to) may be given.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Available courts returned (possibly empty)"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Missing or malformed query parameter"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Club not found")
    })
    @GetMapping("/available-courts")
    public ApiResponse<AvailableCourtsResponse> getAvailableCourts(
            @PathVariable Long clubId,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) String duration,
            @RequestParam(required = false) String sportType
    ) {
        SlotQuery query = SlotQuery.parse(date, start != null ? start : from, duration, to,
                availabilityProperties.getDefaultDurationMinutes());

        return ApiResponse.ok(availabilityService.findAvailableCourts(clubId, query,
                SportType.fromParameter(sportType)));
    }

    @Operation(summary = "Daily availability grid",
            description = "Hour-by-hour status of every active court within the club's business hours")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Grid returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Missing or malformed date"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Club not found")
    })
    @GetMapping("/courts/availability")
    public ApiResponse<DailyAvailabilityResponse> getDailyAvailability(
            @PathVariable Long clubId,
            @RequestParam(required = false) String date
    ) {
        return ApiResponse.ok(dailyAvailabilityService.getDailyAvailability(clubId, SlotQuery.parseDate(date)));
    }
}
