package com.courtbook.court.dto.response;

import com.courtbook.court.domain.Court;

public record AvailableCourtResponse(
        Long id,
        String name,
        String slug,
        String type,
        String surface,
        boolean indoor,
        String sportType,
        int defaultPriceCents,
        int priceCents
) {
    public static AvailableCourtResponse of(Court court, int priceCents) {
        return new AvailableCourtResponse(
                court.getId(),
                court.getName(),
                court.getSlug(),
                court.getType(),
                court.getSurface(),
                court.isIndoor(),
                court.getSportType().name(),
                court.getDefaultPriceCents(),
                priceCents
        );
    }
}
