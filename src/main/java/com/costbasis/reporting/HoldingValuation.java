package com.costbasis.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Mark-to-market view of one open position. Money is rounded to 2 dp.
 *
 * <p>When no live price is known, {@code currentPrice} falls back to the average cost and
 * {@code livePriceAvailable} is false, so unrealized P&L reads as zero rather than missing.
 */
@Value
@Builder
public class HoldingValuation {

    String symbol;
    BigDecimal quantity;
    BigDecimal avgPrice;
    BigDecimal currentPrice;
    BigDecimal currentValue;
    BigDecimal investedValue;
    BigDecimal unrealizedPnl;
    BigDecimal unrealizedPnlPct;
    boolean livePriceAvailable;
}
