package com.costbasis.tax;

import com.costbasis.domain.enums.CostMethod;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One sale in a tax report, with both costing methods side by side.
 * Money is rounded to 2 dp, quantity and the effective deemed rate to 4 dp, holding years to 3 dp.
 */
@Value
@Builder
public class TaxReportRow {

    String saleId;
    String symbol;
    LocalDate sellDate;

    /** Matched quantity only; an unmatched remainder is not taxed. */
    BigDecimal sellQty;

    BigDecimal proceeds;
    BigDecimal actualAcquisitionCost;
    BigDecimal transferTax;
    BigDecimal deductibleExpenses;
    BigDecimal actualTaxableGainLoss;
    BigDecimal deemedRateEffective;
    BigDecimal deemedCost;
    BigDecimal deemedTaxableGainLoss;
    CostMethod selectedMethod;
    BigDecimal selectedTaxableGainLoss;
    BigDecimal avgHoldingYears;
}
