package com.costbasis.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rates and thresholds of the Finnish capital-gains rules.
 *
 * <p>Properties are read from the {@code costbasis.tax.finland} prefix. Defaults are the values in
 * force when this calculator was written; override them per filing year.
 */
@Configuration
@ConfigurationProperties(prefix = "costbasis.tax.finland")
@Getter
@Setter
public class FinlandTaxConfig {

    /** Yearly proceeds at or below this amount are exempt (small-sales rule). */
    private BigDecimal smallSalesThreshold = new BigDecimal("1000");

    /** Deemed acquisition cost as a share of proceeds for holdings under {@link #longHoldingYears}. */
    private BigDecimal deemedRateShort = new BigDecimal("0.20");

    /** Deemed acquisition cost as a share of proceeds for holdings of at least {@link #longHoldingYears}. */
    private BigDecimal deemedRateLong = new BigDecimal("0.40");

    private int longHoldingYears = 10;

    /** Upper limit of the lower capital-income band. */
    private BigDecimal lowerBandLimit = new BigDecimal("30000");

    private BigDecimal lowerBandRate = new BigDecimal("0.30");

    private BigDecimal upperBandRate = new BigDecimal("0.34");

    /** If true, valid splits rescale lots before later sales. Off by default: tradebook prices only. */
    private boolean applyCorporateActions = false;
}
