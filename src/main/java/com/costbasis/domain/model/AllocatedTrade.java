package com.costbasis.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * A trade together with its share of the day's charges.
 *
 * <p>{@code netPrice} is the per-unit price after charges: higher than the gross price for a
 * BUY (charges add to cost basis), lower for a SELL (charges reduce proceeds).
 */
@Value
public class AllocatedTrade {

    Trade trade;
    BigDecimal allocatedCharge;
    BigDecimal netPrice;
}
