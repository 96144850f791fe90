package com.costbasis.reporting;

import com.costbasis.domain.model.SkippedCorporateAction;
import com.costbasis.domain.model.UnmatchedSell;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioDashboard {

    String fy;
    List<String> fyList;
    List<HoldingValuation> holdings;

    /** Trade dates with no charge aggregate: their trades carry gross prices only. */
    List<LocalDate> missingChargeDates;

    List<UnmatchedSell> unmatchedSells;
    List<SkippedCorporateAction> skippedCorporateActions;
    BigDecimal realizedPnl;
    BigDecimal netWorth;
    BigDecimal netWorthYoy;
}
