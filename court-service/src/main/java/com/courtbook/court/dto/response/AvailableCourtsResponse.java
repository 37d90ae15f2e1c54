package com.courtbook.court.dto.response;

import java.util.List;

public record AvailableCourtsResponse(List<AvailableCourtResponse> availableCourts) {

    public static AvailableCourtsResponse empty() {
        return new AvailableCourtsResponse(List.of());
    }
}
