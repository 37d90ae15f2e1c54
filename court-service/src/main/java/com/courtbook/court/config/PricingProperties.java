package com.courtbook.court.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "court.pricing")
public class PricingProperties {

    /**
     * When true, only rules of the same priority tier are checked for
     * conflicts, so a more specific rule may override a broader one.
     */
    private boolean allowTierOverrides = false;
}
