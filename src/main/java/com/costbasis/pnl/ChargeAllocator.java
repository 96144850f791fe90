package com.costbasis.pnl;

import com.costbasis.domain.model.AllocatedTrade;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.Trade;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Spreads each day's aggregated contract-note charges over that day's trades.
 *
 * <p>Contract notes report brokerage, statutory taxes and exchange fees as day totals, not per
 * trade. Each trade gets a share proportional to its gross turnover:
 * <pre>
 *   dailyCharges  = |brokerage| + |taxes| + |other|
 *   dailyTurnover = sum of gross amounts of the day's trades
 *   allocated     = gross / dailyTurnover * dailyCharges
 * </pre>
 * The net unit price is {@code (gross + allocated) / qty} for a BUY and
 * {@code (gross - allocated) / qty} for a SELL. Trades on a date with no aggregate, or on a date
 * with zero turnover, get zero allocation and keep their gross price.
 *
 * <p>Pure transform: output order equals input order, and turnover is summed in input order so the
 * result does not depend on map iteration.
 */
@Component
public class ChargeAllocator {

    private static final Logger log = LoggerFactory.getLogger(ChargeAllocator.class);

    private static final MathContext MC = MathContext.DECIMAL128;

    /**
     * Allocates daily charges to trades.
     *
     * @param trades       validated trades, in ingestion order
     * @param dailyCharges day aggregates; several aggregates for one date are summed
     * @return one allocated trade per input trade, same order
     */
    public List<AllocatedTrade> allocate(List<Trade> trades, List<DailyChargeAggregate> dailyCharges) {
        if (trades == null || trades.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, BigDecimal> chargesByDate = chargesByDate(dailyCharges);

        Map<LocalDate, BigDecimal> turnoverByDate = new LinkedHashMap<>();
        for (Trade trade : trades) {
            turnoverByDate.merge(trade.getDate(), trade.getGrossAmount(), (a, b) -> a.add(b, MC));
        }

        List<AllocatedTrade> allocated = new ArrayList<>(trades.size());
        for (Trade trade : trades) {
            BigDecimal gross = trade.getGrossAmount();
            BigDecimal dayCharges = chargesByDate.getOrDefault(trade.getDate(), BigDecimal.ZERO);
            BigDecimal dayTurnover = turnoverByDate.get(trade.getDate());

            BigDecimal share = BigDecimal.ZERO;
            if (dayTurnover.signum() > 0 && dayCharges.signum() != 0) {
                share = gross.divide(dayTurnover, MC).multiply(dayCharges, MC);
            }

            BigDecimal netAmount = trade.isBuy() ? gross.add(share, MC) : gross.subtract(share, MC);
            BigDecimal netPrice = netAmount.divide(trade.getQuantity(), MC);
            allocated.add(new AllocatedTrade(trade, share, netPrice));
        }

        log.debug("Allocated charges for {} trades across {} dates", trades.size(), turnoverByDate.size());
        return allocated;
    }

    /**
     * Sums allocated charges per date. For any date with turnover and an aggregate this equals the
     * day's total charges within rounding tolerance.
     */
    public Map<LocalDate, BigDecimal> allocatedByDate(List<AllocatedTrade> allocatedTrades) {
        Map<LocalDate, BigDecimal> totals = new LinkedHashMap<>();
        for (AllocatedTrade allocatedTrade : allocatedTrades) {
            totals.merge(allocatedTrade.getTrade().getDate(), allocatedTrade.getAllocatedCharge(), BigDecimal::add);
        }
        return totals;
    }

    /** Day totals keyed by date. A date may carry several contract notes; they are added up. */
    public Map<LocalDate, BigDecimal> chargesByDate(List<DailyChargeAggregate> dailyCharges) {
        Map<LocalDate, BigDecimal> byDate = new HashMap<>();
        if (dailyCharges == null) {
            return byDate;
        }
        for (DailyChargeAggregate aggregate : dailyCharges) {
            if (aggregate == null || aggregate.getDate() == null) {
                continue;
            }
            byDate.merge(aggregate.getDate(), aggregate.getTotalCharges(), BigDecimal::add);
        }
        return byDate;
    }
}
