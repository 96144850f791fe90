package com.costbasis.lot;

import com.costbasis.corporateaction.ApplicableActions;
import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.model.AllocatedTrade;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.FifoMatchResult;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.LotConsumption;
import com.costbasis.domain.model.LotConsumptionResult;
import com.costbasis.domain.model.RealizedGainRecord;
import com.costbasis.domain.model.Trade;
import com.costbasis.domain.model.UnmatchedSell;
import com.costbasis.pnl.ChargeAllocator;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * FIFO cost-basis engine: replays a trade stream into a fresh {@link LotLedger} and reports
 * holdings, realized gains and unmatched sells.
 *
 * <p>Per call:
 * <ol>
 *   <li>trades are charge-allocated by {@link ChargeAllocator}, so lot prices are net of charges</li>
 *   <li>trades are stable-sorted by date; same-day trades keep ingestion order</li>
 *   <li>before each trade, due splits for its symbol are applied to the open lots</li>
 *   <li>BUY appends a lot; SELL consumes lots from the head and accumulates
 *       {@code (netSellPrice - lot.netUnitPrice) * taken}</li>
 * </ol>
 *
 * <p>Nothing is cached between calls. Holdings as of a date are always recomputed from the full
 * history, trading speed for auditability on this report path.
 *
 * <p><b>Thread safety:</b> stateless; each call owns its ledger.
 */
@Service
public class FifoMatcher {

    private static final Logger log = LoggerFactory.getLogger(FifoMatcher.class);

    private static final MathContext MC = MathContext.DECIMAL128;

    private final ChargeAllocator chargeAllocator;
    private final CorporateActionAdjuster corporateActionAdjuster;

    public FifoMatcher(ChargeAllocator chargeAllocator, CorporateActionAdjuster corporateActionAdjuster) {
        this.chargeAllocator = chargeAllocator;
        this.corporateActionAdjuster = corporateActionAdjuster;
    }

    /** Matches the full history without corporate-action adjustment. */
    public FifoMatchResult match(List<Trade> trades, List<DailyChargeAggregate> dailyCharges) {
        return match(trades, dailyCharges, List.of());
    }

    /** Matches the full history, applying every valid split. */
    public FifoMatchResult match(
            List<Trade> trades, List<DailyChargeAggregate> dailyCharges, List<CorporateAction> corporateActions) {
        return run(trades, dailyCharges, corporateActions, null);
    }

    /**
     * Matches trades dated on or before {@code asOf}. Splits effective after {@code asOf} are not
     * applied.
     */
    public FifoMatchResult matchAsOf(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            LocalDate asOf) {
        return run(tradesUpTo(trades, asOf), dailyCharges, corporateActions, asOf);
    }

    /** Open lots per symbol as of the given date, inclusive. */
    public Map<String, List<Lot>> holdingsAsOf(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            LocalDate asOf) {
        return matchAsOf(trades, dailyCharges, corporateActions, asOf).getHoldings();
    }

    /**
     * Open lots from trades dated on or before {@code asOf}, rescaled by every valid split including
     * those effective later. Quantities and prices are in today's units, so the lots can be valued at
     * current market prices.
     */
    public Map<String, List<Lot>> holdingsAsOfInCurrentUnits(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            LocalDate asOf) {
        return run(tradesUpTo(trades, asOf), dailyCharges, corporateActions, null).getHoldings();
    }

    public List<RealizedGainRecord> realizedGains(List<Trade> trades, List<DailyChargeAggregate> dailyCharges) {
        return match(trades, dailyCharges).getRealizedGains();
    }

    public List<UnmatchedSell> unmatchedSells(List<Trade> trades) {
        return match(trades, List.of()).getUnmatchedSells();
    }

    private FifoMatchResult run(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            LocalDate asOf) {
        ApplicableActions actions = corporateActionAdjuster.applicableActions(corporateActions);

        if (trades == null || trades.isEmpty()) {
            return FifoMatchResult.builder()
                    .holdings(Map.of())
                    .realizedGains(List.of())
                    .unmatchedSells(List.of())
                    .skippedCorporateActions(actions.getSkipped())
                    .build();
        }

        List<AllocatedTrade> ordered = new ArrayList<>(chargeAllocator.allocate(trades, dailyCharges));
        ordered.sort(Comparator.comparing((AllocatedTrade a) -> a.getTrade().getDate()));

        LotLedger ledger = new LotLedger(LotLedger.MATCHER_EPSILON);
        SplitSchedule splitSchedule = new SplitSchedule(actions.getSplits(), corporateActionAdjuster);
        List<RealizedGainRecord> realized = new ArrayList<>();
        List<UnmatchedSell> unmatched = new ArrayList<>();

        for (AllocatedTrade allocated : ordered) {
            Trade trade = allocated.getTrade();
            String symbol = trade.getSymbol();
            ledger.touch(symbol);
            splitSchedule.applyDue(ledger, symbol, trade.getDate());

            if (trade.isBuy()) {
                ledger.addLot(
                        symbol,
                        new Lot(trade.getQuantity(), trade.getDate(), trade.getPrice(), allocated.getNetPrice()));
                continue;
            }

            LotConsumptionResult consumed = ledger.consume(symbol, trade.getQuantity());
            realized.add(toRealizedGain(trade, allocated.getNetPrice(), consumed));

            if (consumed.getUnmatchedQuantity().signum() > 0) {
                log.warn(
                        "Unmatched sell: {} on {} sold {} but only {} found in lot history",
                        symbol,
                        trade.getDate(),
                        trade.getQuantity(),
                        consumed.getMatchedQuantity());
                unmatched.add(UnmatchedSell.builder()
                        .symbol(symbol)
                        .sellDate(trade.getDate())
                        .sellQty(trade.getQuantity())
                        .unmatchedQty(consumed.getUnmatchedQuantity().setScale(4, RoundingMode.HALF_UP))
                        .build());
            }
        }

        splitSchedule.applyRemaining(ledger, asOf);

        log.debug(
                "FIFO matched {} trades: {} sells, {} unmatched, {} symbols",
                ordered.size(),
                realized.size(),
                unmatched.size(),
                ledger.holdings().size());

        return FifoMatchResult.builder()
                .holdings(ledger.holdings())
                .realizedGains(Collections.unmodifiableList(realized))
                .unmatchedSells(Collections.unmodifiableList(unmatched))
                .skippedCorporateActions(actions.getSkipped())
                .build();
    }

    private static List<Trade> tradesUpTo(List<Trade> trades, LocalDate asOf) {
        if (trades == null) {
            return List.of();
        }
        return trades.stream()
                .filter(t -> !t.getDate().isAfter(asOf))
                .collect(Collectors.toList());
    }

    private RealizedGainRecord toRealizedGain(Trade trade, BigDecimal netSellPrice, LotConsumptionResult consumed) {
        BigDecimal realizedPnl = BigDecimal.ZERO;
        BigDecimal buyCost = BigDecimal.ZERO;
        BigDecimal buyQuantity = BigDecimal.ZERO;

        for (LotConsumption slice : consumed.getConsumptions()) {
            realizedPnl = realizedPnl.add(
                    netSellPrice.subtract(slice.getNetUnitPrice(), MC).multiply(slice.getQuantity(), MC), MC);
            buyCost = buyCost.add(slice.getNetUnitPrice().multiply(slice.getQuantity(), MC), MC);
            buyQuantity = buyQuantity.add(slice.getQuantity(), MC);
        }

        BigDecimal avgBuyPrice = buyQuantity.signum() > 0 ? buyCost.divide(buyQuantity, MC) : BigDecimal.ZERO;

        return RealizedGainRecord.builder()
                .symbol(trade.getSymbol())
                .sellDate(trade.getDate())
                .sellQty(trade.getQuantity())
                .sellPrice(netSellPrice)
                .avgBuyPrice(avgBuyPrice)
                .realizedPnl(realizedPnl)
                .build();
    }
}
