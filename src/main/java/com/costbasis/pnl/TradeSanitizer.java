package com.costbasis.pnl;

import com.costbasis.domain.enums.TradeSide;
import com.costbasis.domain.model.RawTrade;
import com.costbasis.domain.model.Trade;
import com.costbasis.exception.InvalidInputException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns parser output into validated {@link Trade} records.
 *
 * <p>Policy per row:
 * <ul>
 *   <li>missing date or price, or a non-positive price: the whole batch is rejected</li>
 *   <li>missing or non-positive quantity: row dropped</li>
 *   <li>side that is neither BUY/B nor SELL/S: row dropped, never guessed</li>
 * </ul>
 *
 * <p>Input order is kept because it is the tie-breaker for same-day FIFO ordering.
 */
@Component
public class TradeSanitizer {

    private static final Logger log = LoggerFactory.getLogger(TradeSanitizer.class);

    /**
     * Validates and normalizes a batch of raw rows.
     *
     * @param rawTrades rows from the tradebook parser
     * @return accepted trades in input order
     * @throws InvalidInputException if any row lacks a date or a usable price
     */
    public List<Trade> sanitize(List<RawTrade> rawTrades) {
        if (rawTrades == null || rawTrades.isEmpty()) {
            return List.of();
        }

        List<Trade> accepted = new ArrayList<>(rawTrades.size());
        int dropped = 0;

        for (int i = 0; i < rawTrades.size(); i++) {
            RawTrade raw = rawTrades.get(i);
            requireFields(raw, i);

            if (raw.getQuantity() == null || raw.getQuantity().signum() <= 0) {
                log.debug("Dropping row {} ({}): quantity missing or not positive", i, raw.getTradeId());
                dropped++;
                continue;
            }

            Optional<TradeSide> side = TradeSide.parse(raw.getSide());
            if (side.isEmpty()) {
                log.debug("Dropping row {} ({}): unrecognized side '{}'", i, raw.getTradeId(), raw.getSide());
                dropped++;
                continue;
            }

            String symbol = raw.getSymbol() == null ? "" : raw.getSymbol().trim().toUpperCase(Locale.ROOT);
            String tradeId = raw.getTradeId() == null || raw.getTradeId().isBlank()
                    ? symbol + "-" + raw.getDate() + "-" + i
                    : raw.getTradeId().trim();

            accepted.add(Trade.builder()
                    .tradeId(tradeId)
                    .symbol(symbol)
                    .date(raw.getDate())
                    .side(side.get())
                    .quantity(raw.getQuantity())
                    .price(raw.getPrice())
                    .build());
        }

        if (dropped > 0) {
            log.info("Sanitized {} trade rows: {} accepted, {} dropped", rawTrades.size(), accepted.size(), dropped);
        }
        return accepted;
    }

    private void requireFields(RawTrade raw, int index) {
        if (raw == null) {
            throw new InvalidInputException("Trade row " + index + " is null", index);
        }
        if (raw.getDate() == null) {
            throw new InvalidInputException("Trades data is missing 'date' at row " + index, index);
        }
        BigDecimal price = raw.getPrice();
        if (price == null) {
            throw new InvalidInputException("Trades data is missing 'price' at row " + index, index);
        }
        if (price.signum() <= 0) {
            throw new InvalidInputException(
                    "Trades data has a non-positive 'price' at row " + index, Map.of("row", index, "price", price));
        }
    }
}
