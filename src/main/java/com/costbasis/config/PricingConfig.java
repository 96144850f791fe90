package com.costbasis.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Live price cache settings, prefix {@code costbasis.pricing}.
 */
@Configuration
@ConfigurationProperties(prefix = "costbasis.pricing")
@Getter
@Setter
public class PricingConfig {

    /** How long a resolved symbol set stays cached. */
    private long cacheTtlSeconds = 600;

    /** Upper bound on distinct symbol sets kept. */
    private long cacheMaximumSize = 100;
}
