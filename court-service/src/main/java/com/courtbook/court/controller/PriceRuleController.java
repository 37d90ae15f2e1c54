package com.courtbook.court.controller;

import com.courtbook.common.response.ApiResponse;
import com.courtbook.court.dto.request.CreatePriceRuleRequest;
import com.courtbook.court.dto.request.UpdatePriceRuleRequest;
import com.courtbook.court.dto.response.PriceRuleResponse;
import com.courtbook.court.service.PriceRuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Price Rule", description = "Court price rule management")
@RestController
@RequestMapping("/api/v1/courts/{courtId}/price-rules")
@RequiredArgsConstructor
public class PriceRuleController {

    private final PriceRuleService priceRuleService;

    @Operation(summary = "List price rules", description = "Rules of a court, most specific first")
    @GetMapping
    public ApiResponse<List<PriceRuleResponse>> getRules(@PathVariable Long courtId) {
        return ApiResponse.ok(priceRuleService.getRules(courtId));
    }

    @Operation(summary = "Create price rule")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Rule created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Court or holiday not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflicts with an existing rule")
    })
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<PriceRuleResponse> createRule(
            @PathVariable Long courtId,
            @Valid @RequestBody CreatePriceRuleRequest request
    ) {
        return ApiResponse.ok(priceRuleService.createRule(courtId, request));
    }

    @Operation(summary = "Update price rule", description = "Partial update; omitted fields keep their value")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Rule updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Rule or holiday not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflicts with an existing rule")
    })
    @PatchMapping("/{ruleId}")
    public ApiResponse<PriceRuleResponse> updateRule(
            @PathVariable Long courtId,
            @PathVariable Long ruleId,
            @RequestBody UpdatePriceRuleRequest request
    ) {
        return ApiResponse.ok(priceRuleService.updateRule(courtId, ruleId, request));
    }

    @Operation(summary = "Delete price rule")
    @DeleteMapping("/{ruleId}")
    public ApiResponse<Void> deleteRule(@PathVariable Long courtId, @PathVariable Long ruleId) {
        priceRuleService.deleteRule(courtId, ruleId);
        return ApiResponse.ok();
    }
}
