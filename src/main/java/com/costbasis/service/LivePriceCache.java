package com.costbasis.service;

import com.costbasis.config.PricingConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Caller-side cache of live prices, kept out of the calculation core.
 *
 * <p>Key: the sorted {@code symbol:ticker} pairs of the request, after alias mapping, so a changed
 * alias never serves a stale mapping. Value: the whole lookup result. Entries expire after
 * {@link PricingConfig#getCacheTtlSeconds()}.
 *
 * <p>A failing {@link PriceSource} is not fatal: the failure is logged, every symbol is reported
 * missing, and nothing is cached so the next call retries.
 */
@Slf4j
@Service
public class LivePriceCache {

    private final Cache<String, PriceLookupResult> cache;

    public LivePriceCache(PricingConfig pricingConfig) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(pricingConfig.getCacheTtlSeconds()))
                .maximumSize(pricingConfig.getCacheMaximumSize())
                .build();
    }

    /**
     * Resolves live prices for portfolio symbols.
     *
     * @param symbols     portfolio symbols
     * @param aliasMap    symbol to ticker overrides; unmapped symbols are their own ticker
     * @param priceSource where to fetch on a cache miss
     */
    public PriceLookupResult resolve(
            Collection<String> symbols, Map<String, String> aliasMap, PriceSource priceSource) {
        if (symbols == null || symbols.isEmpty()) {
            return PriceLookupResult.empty();
        }

        Map<String, String> tickersBySymbol = new LinkedHashMap<>();
        for (String symbol : symbols) {
            String alias = aliasMap == null ? null : aliasMap.get(symbol);
            tickersBySymbol.put(symbol, alias != null ? alias.trim().toUpperCase(Locale.ROOT) : symbol);
        }

        String key = cacheKey(tickersBySymbol);
        PriceLookupResult cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        Map<String, BigDecimal> byTicker;
        try {
            byTicker = priceSource.latestPrices(new ArrayList<>(tickersBySymbol.values()));
        } catch (Exception e) {
            log.warn("Live price lookup failed for {} symbols, valuing at cost: {}", symbols.size(), e.getMessage());
            List<PriceLookupResult.MissingPrice> missing = tickersBySymbol.entrySet().stream()
                    .map(entry -> new PriceLookupResult.MissingPrice(entry.getKey(), entry.getValue()))
                    .collect(Collectors.toList());
            return new PriceLookupResult(Map.of(), missing);
        }

        Map<String, BigDecimal> livePrices = new LinkedHashMap<>();
        List<PriceLookupResult.MissingPrice> missing = new ArrayList<>();
        tickersBySymbol.forEach((symbol, ticker) -> {
            BigDecimal price = byTicker == null ? null : byTicker.get(ticker);
            if (price != null) {
                livePrices.put(symbol, price);
            } else {
                missing.add(new PriceLookupResult.MissingPrice(symbol, ticker));
            }
        });

        if (!missing.isEmpty()) {
            log.info("No live price for {} of {} symbols", missing.size(), tickersBySymbol.size());
        }

        PriceLookupResult result =
                new PriceLookupResult(Collections.unmodifiableMap(livePrices), Collections.unmodifiableList(missing));
        cache.put(key, result);
        return result;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    static String cacheKey(Map<String, String> tickersBySymbol) {
        return tickersBySymbol.entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .sorted()
                .collect(Collectors.joining(","));
    }
}
