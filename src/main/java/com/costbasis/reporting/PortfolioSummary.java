package com.costbasis.reporting;

import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

/** Year-over-year view: net worth at each FY end and charges paid within each FY. */
@Value
public class PortfolioSummary {

    @Value
    public static class FyAmount {
        String fy;
        BigDecimal amount;
    }

    List<FyAmount> netWorthByFy;
    List<FyAmount> chargesByFy;
}
