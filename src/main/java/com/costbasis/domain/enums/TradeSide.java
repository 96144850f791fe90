package com.costbasis.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Buy or sell side of an executed trade, as printed on the broker tradebook. */
public enum TradeSide {
    BUY,
    SELL;

    /**
     * Normalizes a free-text side column. Accepts the full word or the single-letter
     * tradebook code in any case. Returns empty for anything else so callers never
     * guess a direction.
     */
    public static Optional<TradeSide> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "B":
            case "BUY":
                return Optional.of(BUY);
            case "S":
            case "SELL":
                return Optional.of(SELL);
            default:
                return Optional.empty();
        }
    }
}
