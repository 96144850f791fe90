package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Charges from all contract notes issued for one trading date.
 *
 * <p>Only actual charges are kept here (brokerage, statutory taxes such as STT/GST/stamp duty,
 * exchange and clearing fees). Settlement amounts are never part of it.
 */
@Value
@Builder
public class DailyChargeAggregate {

    LocalDate date;
    BigDecimal totalBrokerage;
    BigDecimal totalTaxes;
    BigDecimal totalOtherCharges;

    /** Sum of absolute charge components; missing components count as zero. */
    public BigDecimal getTotalCharges() {
        return abs(totalBrokerage).add(abs(totalTaxes)).add(abs(totalOtherCharges));
    }

    private static BigDecimal abs(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value.abs();
    }
}
