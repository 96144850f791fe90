package com.costbasis.lot;

import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.LotConsumption;
import com.costbasis.domain.model.LotConsumptionResult;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol FIFO queues of open purchase lots.
 *
 * <p>Queue order is insertion order, which callers guarantee is acquisition-date order. A sell
 * consumes from the head; a lot is removed once its remaining quantity drops to {@code epsilon} or
 * below.
 *
 * <p><b>Thread safety:</b> none. A ledger belongs to a single calculation call and must not be
 * shared across calls or threads.
 */
public class LotLedger {

    /** Tolerance used by the holdings/realized-gain matcher. */
    public static final BigDecimal MATCHER_EPSILON = new BigDecimal("0.0001");

    /** Tighter tolerance used by the tax calculators. */
    public static final BigDecimal TAX_EPSILON = new BigDecimal("0.0000001");

    private static final MathContext MC = MathContext.DECIMAL128;

    private final BigDecimal epsilon;
    private final Map<String, Deque<Lot>> queues = new LinkedHashMap<>();

    public LotLedger(BigDecimal epsilon) {
        this.epsilon = epsilon;
    }

    /** Appends a lot at the tail of the symbol's queue. */
    public void addLot(String symbol, Lot lot) {
        queue(symbol).addLast(lot);
    }

    /** Makes sure the symbol appears in {@link #holdings()} even before any lot is added. */
    public void touch(String symbol) {
        queue(symbol);
    }

    /**
     * Takes {@code quantity} from the head of the symbol's queue.
     *
     * @return the consumed slices in FIFO order and the quantity that could not be matched
     */
    public LotConsumptionResult consume(String symbol, BigDecimal quantity) {
        Deque<Lot> lots = queue(symbol);
        List<LotConsumption> consumptions = new ArrayList<>();
        BigDecimal remaining = quantity;

        while (remaining.compareTo(epsilon) > 0 && !lots.isEmpty()) {
            Lot head = lots.peekFirst();
            BigDecimal take = head.getQuantity().min(remaining);
            if (take.signum() <= 0) {
                lots.pollFirst();
                continue;
            }

            consumptions.add(new LotConsumption(
                    head.getAcquisitionDate(), head.getGrossUnitPrice(), head.getNetUnitPrice(), take));
            head.reduceBy(take);
            remaining = remaining.subtract(take, MC);

            if (head.getQuantity().compareTo(epsilon) <= 0) {
                lots.pollFirst();
            }
        }

        BigDecimal unmatched = remaining.compareTo(epsilon) > 0 ? remaining : BigDecimal.ZERO;
        return new LotConsumptionResult(Collections.unmodifiableList(consumptions), unmatched);
    }

    /** Replaces the symbol's queue with split-adjusted lots, keeping FIFO order. */
    public void applyCorporateAction(String symbol, CorporateAction action, CorporateActionAdjuster adjuster) {
        Deque<Lot> lots = queues.get(symbol);
        if (lots == null || lots.isEmpty()) {
            return;
        }
        List<Lot> adjusted = adjuster.adjust(new ArrayList<>(lots), action);
        lots.clear();
        lots.addAll(adjusted);
    }

    /** Symbols seen so far, in first-seen order. */
    public List<String> symbols() {
        return new ArrayList<>(queues.keySet());
    }

    /** Sum of remaining quantity for the symbol. */
    public BigDecimal totalQuantity(String symbol) {
        Deque<Lot> lots = queues.get(symbol);
        if (lots == null) {
            return BigDecimal.ZERO;
        }
        return lots.stream().map(Lot::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Quantity-weighted average of the net unit prices in the symbol's queue.
     *
     * @return the full-precision average, or null when nothing is held
     */
    public BigDecimal averageCost(String symbol) {
        Deque<Lot> lots = queues.get(symbol);
        return lots == null ? null : averageCost(lots);
    }

    /** Deep copy of all queues, safe to hand out of the calculation. */
    public Map<String, List<Lot>> holdings() {
        Map<String, List<Lot>> snapshot = new LinkedHashMap<>();
        queues.forEach((symbol, lots) -> {
            List<Lot> copies = new ArrayList<>(lots.size());
            lots.forEach(lot -> copies.add(lot.copy()));
            snapshot.put(symbol, Collections.unmodifiableList(copies));
        });
        return Collections.unmodifiableMap(snapshot);
    }

    /** Average cost over any lot collection, see {@link #averageCost(String)}. */
    public static BigDecimal averageCost(Iterable<Lot> lots) {
        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal quantity = BigDecimal.ZERO;
        for (Lot lot : lots) {
            cost = cost.add(lot.getCostBasis(), MC);
            quantity = quantity.add(lot.getQuantity(), MC);
        }
        if (quantity.signum() <= 0) {
            return null;
        }
        return cost.divide(quantity, MC);
    }

    private Deque<Lot> queue(String symbol) {
        return queues.computeIfAbsent(symbol, s -> new ArrayDeque<>());
    }
}
