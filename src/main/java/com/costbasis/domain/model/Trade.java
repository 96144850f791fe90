package com.costbasis.domain.model;

import com.costbasis.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * An executed equity trade as ingested from the tradebook. Immutable once ingested;
 * identity is {@code tradeId}.
 *
 * <p>Quantity and price are always positive here. Rows that do not satisfy that are
 * filtered or rejected by {@link com.costbasis.pnl.TradeSanitizer} before they reach the core.
 */
@Value
@Builder
public class Trade {

    String tradeId;
    String symbol;
    LocalDate date;
    TradeSide side;
    BigDecimal quantity;
    BigDecimal price;

    public BigDecimal getGrossAmount() {
        return quantity.multiply(price);
    }

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }

    public boolean isSell() {
        return side == TradeSide.SELL;
    }
}
