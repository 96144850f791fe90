package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FifoMatchResult {

    /** Remaining open lots per symbol, in FIFO order. Symbols that were fully sold map to empty lists. */
    Map<String, List<Lot>> holdings;

    List<RealizedGainRecord> realizedGains;
    List<UnmatchedSell> unmatchedSells;
    List<SkippedCorporateAction> skippedCorporateActions;

    public BigDecimal getTotalRealizedPnl() {
        return realizedGains.stream()
                .map(RealizedGainRecord::getRealizedPnl)
                .reduce(BigDecimal.ZERO, (a, b) -> a.add(b, MathContext.DECIMAL128));
    }
}
