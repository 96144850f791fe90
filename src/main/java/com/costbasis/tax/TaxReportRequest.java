package com.costbasis.tax;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one tax report calculation.
 *
 * <p>{@code methodMode} is kept as the raw request code and parsed by {@link TaxRequestValidator},
 * so an unknown mode is rejected before any calculation starts. {@code baseCurrency} is
 * informational only; no FX conversion is done.
 */
@Value
@Builder
public class TaxReportRequest {

    String countryCode;
    int taxYear;

    @Builder.Default
    String methodMode = "auto_best_per_sale";

    @Builder.Default
    BigDecimal priorLossCarryforward = BigDecimal.ZERO;

    @Builder.Default
    boolean includeRows = true;

    @Builder.Default
    String baseCurrency = "EUR";

    String notes;
}
