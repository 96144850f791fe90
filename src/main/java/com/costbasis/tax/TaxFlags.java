package com.costbasis.tax;

import lombok.Value;

@Value
public class TaxFlags {

    boolean smallSalesExemptionApplied;

    /** Set when the year closed at a net loss that the small-sales exemption makes non-deductible. */
    boolean lossNonDeductibleDueToSmallSalesRule;
}
