package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A tradebook row as delivered by the document parser. Every field may be null and
 * {@code side} is the untouched text of the buy/sell column.
 */
@Value
@Builder
public class RawTrade {

    String tradeId;
    String symbol;
    LocalDate date;
    String side;
    BigDecimal quantity;
    BigDecimal price;
}
