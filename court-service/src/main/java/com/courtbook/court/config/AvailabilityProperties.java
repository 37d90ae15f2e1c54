package com.courtbook.court.config;

import com.courtbook.court.domain.TimeRange;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "court.availability")
public class AvailabilityProperties {

    /** Zone in which a date and wall-clock time become booking instants. */
    private ZoneId zone = ZoneId.of("UTC");
    private String defaultOpenTime = "09:00";
    private String defaultCloseTime = "22:00";
    private int defaultDurationMinutes = 60;

    public TimeRange defaultBusinessHours() {
        return TimeRange.of(defaultOpenTime, defaultCloseTime);
    }
}
