package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

@Value
public class LotConsumptionResult {

    List<LotConsumption> consumptions;

    /** Quantity left over once the queue ran dry; zero when the sell was fully matched. */
    BigDecimal unmatchedQuantity;

    public BigDecimal getMatchedQuantity() {
        return consumptions.stream()
                .map(LotConsumption::getQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
