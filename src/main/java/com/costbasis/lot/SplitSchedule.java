package com.costbasis.lot;

import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.model.CorporateAction;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies each split exactly once while a trade stream is replayed into a fresh {@link LotLedger}.
 *
 * <p>A split is applied to a symbol's queue right before the first trade of that symbol dated on or
 * after the effective date. At that point every queued lot predates the split. Splits still pending
 * at the end of the stream are applied by {@link #applyRemaining(LotLedger, LocalDate)} so holdings
 * come out in post-split units.
 *
 * <p>Split symbols and ledger symbols are matched case-insensitively, ignoring surrounding blanks.
 */
public class SplitSchedule {

    private final Map<String, List<CorporateAction>> splitsByKey = new HashMap<>();
    private final Map<String, Deque<CorporateAction>> pendingBySymbol = new HashMap<>();
    private final CorporateActionAdjuster adjuster;

    /**
     * @param splits   validated splits in ascending effective-date order
     * @param adjuster the adjuster that rescales lots
     */
    public SplitSchedule(List<CorporateAction> splits, CorporateActionAdjuster adjuster) {
        this.adjuster = adjuster;
        for (CorporateAction split : splits) {
            splitsByKey.computeIfAbsent(key(split.getSymbol()), s -> new ArrayList<>()).add(split);
        }
    }

    /** Applies every pending split for {@code symbol} effective on or before {@code date}. */
    public int applyDue(LotLedger ledger, String symbol, LocalDate date) {
        Deque<CorporateAction> pending = pending(symbol);
        int applied = 0;
        while (!pending.isEmpty() && !pending.peekFirst().getEffectiveDate().isAfter(date)) {
            ledger.applyCorporateAction(symbol, pending.pollFirst(), adjuster);
            applied++;
        }
        return applied;
    }

    /**
     * Applies the splits left over after the last trade to every symbol in the ledger.
     *
     * @param asOf only splits effective on or before this date; null applies all of them
     */
    public int applyRemaining(LotLedger ledger, LocalDate asOf) {
        int applied = 0;
        for (String symbol : ledger.symbols()) {
            Deque<CorporateAction> pending = pending(symbol);
            while (!pending.isEmpty()
                    && (asOf == null || !pending.peekFirst().getEffectiveDate().isAfter(asOf))) {
                ledger.applyCorporateAction(symbol, pending.pollFirst(), adjuster);
                applied++;
            }
        }
        return applied;
    }

    // each ledger symbol gets its own copy, so "abc" and "ABC" queues are both rescaled
    private Deque<CorporateAction> pending(String symbol) {
        return pendingBySymbol.computeIfAbsent(
                symbol, s -> new ArrayDeque<>(splitsByKey.getOrDefault(key(s), List.of())));
    }

    private static String key(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
