package com.costbasis.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Value;

@Value
public class PriceLookupResult {

    /** A symbol whose price could not be found, with the ticker that was tried. */
    @Value
    public static class MissingPrice {
        String symbol;
        String attemptedTicker;
    }

    /** Price keyed by portfolio symbol, not by ticker. */
    Map<String, BigDecimal> livePrices;

    List<MissingPrice> missingSymbols;

    public static PriceLookupResult empty() {
        return new PriceLookupResult(Map.of(), List.of());
    }
}
