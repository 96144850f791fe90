package com.costbasis.service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Market data lookup implemented outside this project (e.g. a quote API client).
 */
@FunctionalInterface
public interface PriceSource {

    /**
     * Fetches the latest close for each ticker.
     *
     * @param tickers exchange tickers after alias resolution
     * @return price per ticker; tickers without a usable price are simply absent
     * @throws Exception any retrieval failure; the cache logs it and reports all symbols missing
     */
    Map<String, BigDecimal> latestPrices(Iterable<String> tickers) throws Exception;
}
