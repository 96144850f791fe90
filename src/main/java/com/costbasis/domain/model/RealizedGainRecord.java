package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Realized result of one SELL trade. {@code sellQty} is the full quantity sold, including any
 * unmatched part, which contributes nothing to {@code realizedPnl}.
 */
@Value
@Builder
public class RealizedGainRecord {

    String symbol;
    LocalDate sellDate;
    BigDecimal sellQty;
    BigDecimal sellPrice;
    BigDecimal avgBuyPrice;
    BigDecimal realizedPnl;
}
