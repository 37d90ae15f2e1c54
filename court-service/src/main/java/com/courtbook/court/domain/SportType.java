package com.courtbook.court.domain;

import com.courtbook.common.exception.BusinessException;
import com.courtbook.common.response.ErrorCode;

import java.util.Arrays;

public enum SportType {
    PADEL,
    TENNIS,
    PICKLEBALL,
    SQUASH,
    BADMINTON;

    /**
     * Case-insensitive; {@code null} or blank means no filter.
     */
    public static SportType fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_SPORT_TYPE,
                        "Invalid sport type: " + value));
    }
}
