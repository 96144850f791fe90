package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A sell larger than the known lot history for its symbol. Broker history can legitimately
 * start mid-position, so this is reported as data and left to the caller.
 */
@Value
@Builder
public class UnmatchedSell {

    String symbol;
    LocalDate sellDate;
    BigDecimal sellQty;
    BigDecimal unmatchedQty;
}
