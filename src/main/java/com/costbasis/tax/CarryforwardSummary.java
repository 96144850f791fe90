package com.costbasis.tax;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class CarryforwardSummary {

    BigDecimal priorLossCarryforward;
    BigDecimal lossUsedThisYear;
    BigDecimal lossToCarryforwardNextYear;
}
