package com.costbasis.unit.lot;

import static org.assertj.core.api.Assertions.assertThat;

import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.enums.CorporateActionType;
import com.costbasis.domain.enums.TradeSide;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.FifoMatchResult;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.RealizedGainRecord;
import com.costbasis.domain.model.SkippedCorporateAction;
import com.costbasis.domain.model.Trade;
import com.costbasis.domain.model.UnmatchedSell;
import com.costbasis.lot.FifoMatcher;
import com.costbasis.pnl.ChargeAllocator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FifoMatcher with real charge allocation and split adjustment.
 *
 * <p>Reference history for INFY:
 * BUY 10 @ 100 on 2023-01-10, BUY 10 @ 120 on 2023-06-01, SELL 15 @ 150 on 2024-01-10.
 * Realized = 10 * (150 - 100) + 5 * (150 - 120) = 500 + 150 = 650.
 */
class FifoMatcherTest {

    private FifoMatcher fifoMatcher;

    @BeforeEach
    void setUp() {
        fifoMatcher = new FifoMatcher(new ChargeAllocator(), new CorporateActionAdjuster());
    }

    // ==============================
    // REALIZED GAINS
    // ==============================

    @Nested
    @DisplayName("Realized Gains")
    class RealizedGains {

        @Test
        @DisplayName("Sell spanning two lots realizes per-lot gains")
        void referenceScenario() {
            FifoMatchResult result = fifoMatcher.match(referenceTrades(), List.of());

            assertThat(result.getRealizedGains()).hasSize(1);
            RealizedGainRecord record = result.getRealizedGains().get(0);
            assertThat(record.getRealizedPnl()).isEqualByComparingTo("650");
            assertThat(record.getSellQty()).isEqualByComparingTo("15");
            // (10 * 100 + 5 * 120) / 15 = 106.666...
            assertThat(record.getAvgBuyPrice().setScale(2, RoundingMode.HALF_UP))
                    .isEqualByComparingTo("106.67");
            assertThat(result.getTotalRealizedPnl()).isEqualByComparingTo("650");
        }

        @Test
        @DisplayName("Remaining lot is the unconsumed part of the second buy")
        void remainingLot() {
            Map<String, List<Lot>> holdings = fifoMatcher.match(referenceTrades(), List.of()).getHoldings();

            assertThat(holdings.get("INFY")).hasSize(1);
            Lot remaining = holdings.get("INFY").get(0);
            assertThat(remaining.getQuantity()).isEqualByComparingTo("5");
            assertThat(remaining.getUnitPrice()).isEqualByComparingTo("120");
            assertThat(remaining.getAcquisitionDate()).isEqualTo(LocalDate.of(2023, 6, 1));
        }

        @Test
        @DisplayName("Charges flow into both buy cost and sell proceeds")
        void chargesAdjustPnl() {
            List<Trade> trades = List.of(
                    trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("S1", "2024-01-10", TradeSide.SELL, "10", "150"));
            List<DailyChargeAggregate> charges = List.of(
                    charges("2023-01-10", "10"),
                    charges("2024-01-10", "15"));

            RealizedGainRecord record = fifoMatcher.realizedGains(trades, charges).get(0);

            // buy net (1000 + 10) / 10 = 101, sell net (1500 - 15) / 10 = 148.5
            // (148.5 - 101) * 10 = 475
            assertThat(record.getRealizedPnl()).isEqualByComparingTo("475");
            assertThat(record.getSellPrice()).isEqualByComparingTo("148.5");
            assertThat(record.getAvgBuyPrice()).isEqualByComparingTo("101");
        }

        @Test
        @DisplayName("Input order does not matter across dates")
        void sortedByDate() {
            List<Trade> shuffled = List.of(
                    referenceTrades().get(2), referenceTrades().get(1), referenceTrades().get(0));

            assertThat(fifoMatcher.match(shuffled, List.of()).getTotalRealizedPnl()).isEqualByComparingTo("650");
        }

        @Test
        @DisplayName("Same-day buys are consumed in ingestion order")
        void sameDayIngestionOrder() {
            List<Trade> trades = List.of(
                    trade("A", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("B", "2023-01-10", TradeSide.BUY, "10", "200"),
                    trade("S", "2023-02-10", TradeSide.SELL, "10", "300"));

            // consumes A: (300 - 100) * 10 = 2000
            assertThat(fifoMatcher.match(trades, List.of()).getTotalRealizedPnl()).isEqualByComparingTo("2000");
        }

        @Test
        @DisplayName("Symbols are matched independently")
        void symbolsIndependent() {
            List<Trade> trades = List.of(
                    trade("B1", "INFY", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("B2", "TCS", "2023-01-11", TradeSide.BUY, "10", "300"),
                    trade("S1", "TCS", "2023-02-10", TradeSide.SELL, "5", "310"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of());

            // (310 - 300) * 5 = 50
            assertThat(result.getTotalRealizedPnl()).isEqualByComparingTo("50");
            assertThat(result.getHoldings().get("INFY").get(0).getQuantity()).isEqualByComparingTo("10");
            assertThat(result.getHoldings().get("TCS").get(0).getQuantity()).isEqualByComparingTo("5");
        }
    }

    // ==============================
    // UNMATCHED SELLS
    // ==============================

    @Nested
    @DisplayName("Unmatched Sells")
    class UnmatchedSells {

        @Test
        @DisplayName("Sell larger than history records the shortfall")
        void partialShortfall() {
            List<Trade> trades = List.of(
                    trade("B1", "2023-01-10", TradeSide.BUY, "5", "100"),
                    trade("S1", "2023-03-10", TradeSide.SELL, "8", "110"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of());

            assertThat(result.getUnmatchedSells()).hasSize(1);
            UnmatchedSell unmatched = result.getUnmatchedSells().get(0);
            assertThat(unmatched.getSellQty()).isEqualByComparingTo("8");
            assertThat(unmatched.getUnmatchedQty()).isEqualByComparingTo("3.0000");
            assertThat(unmatched.getUnmatchedQty().scale()).isEqualTo(4);
            // realized only on the 5 matched: (110 - 100) * 5 = 50
            assertThat(result.getRealizedGains().get(0).getRealizedPnl()).isEqualByComparingTo("50");
            assertThat(result.getRealizedGains().get(0).getSellQty()).isEqualByComparingTo("8");
        }

        @Test
        @DisplayName("Sell with no lot history still gets a zero gain record")
        void noHistory() {
            List<Trade> trades = List.of(trade("S1", "2023-03-10", TradeSide.SELL, "8", "110"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of());

            assertThat(result.getRealizedGains().get(0).getRealizedPnl()).isEqualByComparingTo("0");
            assertThat(result.getRealizedGains().get(0).getAvgBuyPrice()).isEqualByComparingTo("0");
            assertThat(fifoMatcher.unmatchedSells(trades).get(0).getUnmatchedQty()).isEqualByComparingTo("8");
            assertThat(result.getHoldings()).containsKey("INFY");
            assertThat(result.getHoldings().get("INFY")).isEmpty();
        }

        @Test
        @DisplayName("Fully matched history has no unmatched sells")
        void fullyMatched() {
            assertThat(fifoMatcher.unmatchedSells(referenceTrades())).isEmpty();
        }
    }

    // ==============================
    // SPLITS
    // ==============================

    @Nested
    @DisplayName("Split Adjustment")
    class SplitAdjustment {

        @Test
        @DisplayName("Sell after a split matches post-split units")
        void sellAfterSplit() {
            List<Trade> trades = List.of(
                    trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("S1", "2023-04-01", TradeSide.SELL, "20", "60"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of(), List.of(split("2023-03-01", "1", "2")));

            // lot becomes 20 @ 50: (60 - 50) * 20 = 200
            assertThat(result.getTotalRealizedPnl()).isEqualByComparingTo("200");
            assertThat(result.getUnmatchedSells()).isEmpty();
            assertThat(result.getHoldings().get("INFY")).isEmpty();
        }

        @Test
        @DisplayName("Split after the last trade still rescales holdings")
        void splitAfterLastTrade() {
            List<Trade> trades = List.of(trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"));
            List<CorporateAction> actions = List.of(split("2024-01-01", "1", "2"));

            Lot lot = fifoMatcher.match(trades, List.of(), actions).getHoldings().get("INFY").get(0);

            assertThat(lot.getQuantity()).isEqualByComparingTo("20");
            assertThat(lot.getUnitPrice()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Holdings as of a date before the split are in pre-split units")
        void holdingsAsOfBeforeSplit() {
            List<Trade> trades = List.of(trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"));
            List<CorporateAction> actions = List.of(split("2024-01-01", "1", "2"));

            Lot lot = fifoMatcher
                    .holdingsAsOf(trades, List.of(), actions, LocalDate.of(2023, 12, 31))
                    .get("INFY")
                    .get(0);

            assertThat(lot.getQuantity()).isEqualByComparingTo("10");
            assertThat(lot.getUnitPrice()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Split symbol matches trades regardless of case")
        void splitMatchesLowerCaseSymbol() {
            List<Trade> trades = List.of(trade("B1", "abc", "2023-01-10", TradeSide.BUY, "10", "100"));
            CorporateAction split = CorporateAction.builder()
                    .symbol("abc")
                    .actionType(CorporateActionType.SPLIT)
                    .effectiveDate(LocalDate.of(2023, 3, 1))
                    .ratioFrom(BigDecimal.ONE)
                    .ratioTo(BigDecimal.TEN)
                    .active(true)
                    .build();

            Lot lot = fifoMatcher.match(trades, List.of(), List.of(split)).getHoldings().get("abc").get(0);

            // 1:10 split: 10 @ 100 becomes 100 @ 10
            assertThat(lot.getQuantity()).isEqualByComparingTo("100");
            assertThat(lot.getUnitPrice()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Split due before a later trade applies to a lower-case symbol")
        void splitDueBeforeLaterTradeLowerCase() {
            List<Trade> trades = List.of(
                    trade("B1", "infy", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("S1", "infy", "2023-04-01", TradeSide.SELL, "20", "60"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of(), List.of(split("2023-03-01", "1", "2")));

            // (60 - 50) * 20 = 200
            assertThat(result.getTotalRealizedPnl()).isEqualByComparingTo("200");
            assertThat(result.getUnmatchedSells()).isEmpty();
        }

        @Test
        @DisplayName("Holdings as of a past date can be expressed in current split units")
        void holdingsAsOfInCurrentUnits() {
            List<Trade> trades = List.of(
                    trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"),
                    trade("B2", "2024-06-01", TradeSide.BUY, "5", "60"));
            List<CorporateAction> actions = List.of(split("2024-01-01", "1", "2"));

            List<Lot> lots = fifoMatcher
                    .holdingsAsOfInCurrentUnits(trades, List.of(), actions, LocalDate.of(2023, 12, 31))
                    .get("INFY");

            // only B1 is held at the date, rescaled by the later split to 20 @ 50
            assertThat(lots).hasSize(1);
            assertThat(lots.get(0).getQuantity()).isEqualByComparingTo("20");
            assertThat(lots.get(0).getUnitPrice()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Repeated calls do not compound a split")
        void idempotentAcrossCalls() {
            List<Trade> trades = List.of(trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"));
            List<CorporateAction> actions = List.of(split("2023-03-01", "1", "2"));

            fifoMatcher.match(trades, List.of(), actions);
            Lot lot = fifoMatcher.match(trades, List.of(), actions).getHoldings().get("INFY").get(0);

            assertThat(lot.getQuantity()).isEqualByComparingTo("20");
        }

        @Test
        @DisplayName("Invalid split is reported and not applied")
        void invalidSplitSkipped() {
            List<Trade> trades = List.of(trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"));

            FifoMatchResult result = fifoMatcher.match(trades, List.of(), List.of(split("2023-03-01", "0", "2")));

            assertThat(result.getSkippedCorporateActions())
                    .extracting(SkippedCorporateAction::getReason)
                    .containsExactly(SkippedCorporateAction.Reason.INVALID_RATIO);
            assertThat(result.getHoldings().get("INFY").get(0).getQuantity()).isEqualByComparingTo("10");
        }
    }

    // ==============================
    // AS-OF VIEWS
    // ==============================

    @Nested
    @DisplayName("As-Of Views")
    class AsOfViews {

        @Test
        @DisplayName("Trades after the as-of date are ignored")
        void laterTradesIgnored() {
            Map<String, List<Lot>> holdings =
                    fifoMatcher.holdingsAsOf(referenceTrades(), List.of(), List.of(), LocalDate.of(2023, 12, 31));

            assertThat(holdings.get("INFY")).hasSize(2);
        }

        @Test
        @DisplayName("Empty trade list yields empty result")
        void emptyTrades() {
            FifoMatchResult result = fifoMatcher.match(List.of(), List.of());

            assertThat(result.getHoldings()).isEmpty();
            assertThat(result.getRealizedGains()).isEmpty();
            assertThat(result.getTotalRealizedPnl()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    private List<Trade> referenceTrades() {
        return List.of(
                trade("B1", "2023-01-10", TradeSide.BUY, "10", "100"),
                trade("B2", "2023-06-01", TradeSide.BUY, "10", "120"),
                trade("S1", "2024-01-10", TradeSide.SELL, "15", "150"));
    }

    private Trade trade(String id, String date, TradeSide side, String qty, String price) {
        return trade(id, "INFY", date, side, qty, price);
    }

    private Trade trade(String id, String symbol, String date, TradeSide side, String qty, String price) {
        return Trade.builder()
                .tradeId(id)
                .symbol(symbol)
                .date(LocalDate.parse(date))
                .side(side)
                .quantity(new BigDecimal(qty))
                .price(new BigDecimal(price))
                .build();
    }

    private DailyChargeAggregate charges(String date, String brokerage) {
        return DailyChargeAggregate.builder()
                .date(LocalDate.parse(date))
                .totalBrokerage(new BigDecimal(brokerage))
                .totalTaxes(BigDecimal.ZERO)
                .totalOtherCharges(BigDecimal.ZERO)
                .build();
    }

    private CorporateAction split(String effective, String from, String to) {
        return CorporateAction.builder()
                .symbol("INFY")
                .actionType(CorporateActionType.SPLIT)
                .effectiveDate(LocalDate.parse(effective))
                .ratioFrom(new BigDecimal(from))
                .ratioTo(new BigDecimal(to))
                .active(true)
                .build();
    }
}
