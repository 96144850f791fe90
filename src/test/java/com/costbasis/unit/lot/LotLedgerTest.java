package com.costbasis.unit.lot;

import static org.assertj.core.api.Assertions.assertThat;

import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.enums.CorporateActionType;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.LotConsumption;
import com.costbasis.domain.model.LotConsumptionResult;
import com.costbasis.lot.LotLedger;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LotLedger FIFO consumption, epsilon handling and snapshots.
 *
 * <p>Reference queue for INFY: 10 @ 100 (2023-01-10), then 10 @ 120 (2023-06-01).
 */
class LotLedgerTest {

    private static final LocalDate FIRST = LocalDate.of(2023, 1, 10);
    private static final LocalDate SECOND = LocalDate.of(2023, 6, 1);

    private LotLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new LotLedger(LotLedger.MATCHER_EPSILON);
        ledger.addLot("INFY", lot("10", FIRST, "100"));
        ledger.addLot("INFY", lot("10", SECOND, "120"));
    }

    @Nested
    @DisplayName("FIFO Consumption")
    class FifoConsumption {

        @Test
        @DisplayName("Sell spanning two lots consumes the oldest first")
        void spansLotsOldestFirst() {
            LotConsumptionResult result = ledger.consume("INFY", new BigDecimal("15"));

            assertThat(result.getConsumptions())
                    .extracting(LotConsumption::getAcquisitionDate)
                    .containsExactly(FIRST, SECOND);
            assertThat(result.getConsumptions().get(0).getQuantity()).isEqualByComparingTo("10");
            assertThat(result.getConsumptions().get(1).getQuantity()).isEqualByComparingTo("5");
            assertThat(result.getUnmatchedQuantity()).isEqualByComparingTo("0");

            // 10 @ 100 gone, 5 @ 120 left at the head
            Map<String, List<Lot>> holdings = ledger.holdings();
            assertThat(holdings.get("INFY")).hasSize(1);
            assertThat(holdings.get("INFY").get(0).getQuantity()).isEqualByComparingTo("5");
            assertThat(holdings.get("INFY").get(0).getNetUnitPrice()).isEqualByComparingTo("120");
        }

        @Test
        @DisplayName("Oversized sell reports the unmatched remainder and empties the queue")
        void unmatchedRemainder() {
            LotConsumptionResult result = ledger.consume("INFY", new BigDecimal("23"));

            assertThat(result.getMatchedQuantity()).isEqualByComparingTo("20");
            assertThat(result.getUnmatchedQuantity()).isEqualByComparingTo("3");
            assertThat(ledger.totalQuantity("INFY")).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Sell of an unknown symbol matches nothing")
        void unknownSymbol() {
            LotConsumptionResult result = ledger.consume("TCS", new BigDecimal("4"));

            assertThat(result.getConsumptions()).isEmpty();
            assertThat(result.getUnmatchedQuantity()).isEqualByComparingTo("4");
        }

        @Test
        @DisplayName("Residue at or below epsilon closes the lot")
        void residueBelowEpsilonRemoved() {
            ledger.consume("INFY", new BigDecimal("9.99995"));

            // 0.00005 left on the first lot is below 0.0001, so it is dropped
            assertThat(ledger.holdings().get("INFY")).hasSize(1);
            assertThat(ledger.holdings().get("INFY").get(0).getAcquisitionDate()).isEqualTo(SECOND);
        }

        @Test
        @DisplayName("Remainder within epsilon is not reported as unmatched")
        void tinyRemainderIgnored() {
            LotConsumptionResult result = ledger.consume("INFY", new BigDecimal("20.00005"));

            assertThat(result.getUnmatchedQuantity()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Aggregates and Snapshots")
    class AggregatesAndSnapshots {

        @Test
        @DisplayName("Average cost is quantity weighted over net prices")
        void averageCost() {
            // (10 * 100 + 10 * 120) / 20 = 110
            assertThat(ledger.averageCost("INFY")).isEqualByComparingTo("110");
            assertThat(ledger.averageCost("TCS")).isNull();
        }

        @Test
        @DisplayName("Touched symbol shows up with no lots")
        void touchedSymbolPresent() {
            ledger.touch("TCS");

            assertThat(ledger.holdings()).containsKey("TCS");
            assertThat(ledger.holdings().get("TCS")).isEmpty();
        }

        @Test
        @DisplayName("Snapshot is unaffected by later consumption")
        void snapshotIsDeepCopy() {
            Map<String, List<Lot>> before = ledger.holdings();

            ledger.consume("INFY", new BigDecimal("12"));

            assertThat(before.get("INFY")).hasSize(2);
            assertThat(before.get("INFY").get(0).getQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Split replaces the queue with rescaled lots in the same order")
        void splitRescalesQueue() {
            CorporateAction split = CorporateAction.builder()
                    .symbol("INFY")
                    .actionType(CorporateActionType.SPLIT)
                    .effectiveDate(LocalDate.of(2023, 3, 1))
                    .ratioFrom(BigDecimal.ONE)
                    .ratioTo(new BigDecimal("2"))
                    .active(true)
                    .build();

            ledger.applyCorporateAction("INFY", split, new CorporateActionAdjuster());

            // only the January lot predates the split: 10 -> 20, second lot untouched
            List<Lot> lots = ledger.holdings().get("INFY");
            assertThat(lots.get(0).getQuantity()).isEqualByComparingTo("20");
            assertThat(lots.get(0).getNetUnitPrice()).isEqualByComparingTo("50");
            assertThat(lots.get(1).getQuantity()).isEqualByComparingTo("10");
            assertThat(ledger.totalQuantity("INFY")).isEqualByComparingTo("30");
        }
    }

    private Lot lot(String qty, LocalDate date, String price) {
        BigDecimal p = new BigDecimal(price);
        return new Lot(new BigDecimal(qty), date, p, p);
    }
}
