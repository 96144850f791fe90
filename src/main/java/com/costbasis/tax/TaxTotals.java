package com.costbasis.tax;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TaxTotals {

    BigDecimal proceeds;
    BigDecimal actualGainLoss;
    BigDecimal deemedGainLoss;
    BigDecimal selectedGainLossBeforeAdjustments;
    BigDecimal selectedGainLossAfterAdjustments;
    BigDecimal estimatedTax;

    public static TaxTotals zero() {
        return TaxTotals.builder()
                .proceeds(BigDecimal.ZERO)
                .actualGainLoss(BigDecimal.ZERO)
                .deemedGainLoss(BigDecimal.ZERO)
                .selectedGainLossBeforeAdjustments(BigDecimal.ZERO)
                .selectedGainLossAfterAdjustments(BigDecimal.ZERO)
                .estimatedTax(BigDecimal.ZERO)
                .build();
    }
}
