package com.costbasis.pnl;

import com.costbasis.domain.model.Lot;
import com.costbasis.lot.LotLedger;
import com.costbasis.reporting.HoldingValuation;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Values open lots against live prices: unrealized P&L per symbol and portfolio net worth.
 *
 * <p>Unrealized P&L = (currentPrice - avgPrice) * quantity, where avgPrice is the quantity-weighted
 * net cost of the remaining FIFO lots. Symbols holding 0.01 units or less are treated as closed.
 * A symbol without a live price is valued at its average cost.
 *
 * <p>Live prices are passed in; this service never fetches them.
 */
@Service
public class PortfolioValuationService {

    /** Positions at or below this quantity are dust left by rounding and are not reported. */
    static final BigDecimal MIN_OPEN_QUANTITY = new BigDecimal("0.01");

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param holdings   open lots per symbol
     * @param livePrices latest price per symbol; may be missing symbols
     * @return one valuation per open symbol, in holdings order
     */
    public List<HoldingValuation> value(Map<String, List<Lot>> holdings, Map<String, BigDecimal> livePrices) {
        List<HoldingValuation> valuations = new ArrayList<>();

        holdings.forEach((symbol, lots) -> {
            BigDecimal quantity = totalQuantity(lots);
            if (quantity.compareTo(MIN_OPEN_QUANTITY) <= 0) {
                return;
            }
            BigDecimal avgPrice = LotLedger.averageCost(lots).abs();
            BigDecimal livePrice = livePrices == null ? null : livePrices.get(symbol);
            BigDecimal currentPrice = livePrice != null ? livePrice : avgPrice;

            BigDecimal currentValue = quantity.multiply(currentPrice, MC);
            BigDecimal investedValue = quantity.multiply(avgPrice, MC);
            BigDecimal pnlPct = avgPrice.signum() > 0
                    ? currentPrice.subtract(avgPrice).divide(avgPrice, MC).multiply(HUNDRED)
                    : BigDecimal.ZERO;

            valuations.add(HoldingValuation.builder()
                    .symbol(symbol)
                    .quantity(quantity.setScale(2, RoundingMode.HALF_UP))
                    .avgPrice(money(avgPrice))
                    .currentPrice(money(currentPrice))
                    .currentValue(money(currentValue))
                    .investedValue(money(investedValue))
                    .unrealizedPnl(money(currentValue.subtract(investedValue)))
                    .unrealizedPnlPct(money(pnlPct))
                    .livePriceAvailable(livePrice != null)
                    .build());
        });

        return valuations;
    }

    /**
     * Market value of all open positions, falling back to average cost where no live price exists.
     * Rounded to 2 dp.
     */
    public BigDecimal netWorth(Map<String, List<Lot>> holdings, Map<String, BigDecimal> livePrices) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, List<Lot>> entry : holdings.entrySet()) {
            BigDecimal quantity = totalQuantity(entry.getValue());
            if (quantity.compareTo(MIN_OPEN_QUANTITY) <= 0) {
                continue;
            }
            BigDecimal price = livePrices == null ? null : livePrices.get(entry.getKey());
            if (price == null) {
                price = LotLedger.averageCost(entry.getValue());
            }
            total = total.add(quantity.multiply(price, MC), MC);
        }
        return money(total);
    }

    /** Symbols with an open position, for live price lookup. */
    public List<String> openSymbols(Map<String, List<Lot>> holdings) {
        List<String> symbols = new ArrayList<>();
        holdings.forEach((symbol, lots) -> {
            if (totalQuantity(lots).compareTo(MIN_OPEN_QUANTITY) > 0) {
                symbols.add(symbol);
            }
        });
        return symbols;
    }

    private static BigDecimal totalQuantity(List<Lot> lots) {
        return lots.stream().map(Lot::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
