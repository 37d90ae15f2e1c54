package com.courtbook.court.controller;

import com.courtbook.common.response.ApiResponse;
import com.courtbook.court.config.AvailabilityProperties;
import com.courtbook.court.dto.request.SlotQuery;
import com.courtbook.court.dto.response.PriceTimelineResponse;
import com.courtbook.court.dto.response.SlotPriceResponse;
import com.courtbook.court.service.PriceResolver;
import com.courtbook.court.service.PriceTimelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Court Price", description = "Resolved slot prices and daily price timelines")
@RestController
@RequestMapping("/api/v1/courts/{courtId}")
@RequiredArgsConstructor
public class CourtPriceController {

    private final PriceResolver priceResolver;
    private final PriceTimelineService priceTimelineService;
    private final AvailabilityProperties availabilityProperties;

    @Operation(summary = "Resolve slot price", description = "Price of [start, start + duration) after applying price rules")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Price resolved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Missing or malformed query parameter"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Court not found")
    })
    @GetMapping("/price")
    public ApiResponse<SlotPriceResponse> getPrice(
            @PathVariable Long courtId,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String duration
    ) {
        SlotQuery query = SlotQuery.parse(date, start, duration, null,
                availabilityProperties.getDefaultDurationMinutes());

        return ApiResponse.ok(priceResolver.resolvePrice(courtId, query.date(), query.slot()));
    }

    @Operation(summary = "Price timeline", description = "Priced segments of the day; other minutes use the default price")
    @GetMapping("/price-timeline")
    public ApiResponse<PriceTimelineResponse> getPriceTimeline(
            @PathVariable Long courtId,
            @RequestParam(required = false) String date
    ) {
        return ApiResponse.ok(priceTimelineService.getTimeline(courtId, SlotQuery.parseDate(date)));
    }
}
