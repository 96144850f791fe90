package com.costbasis.domain.model;

import com.costbasis.domain.enums.CorporateActionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A corporate action discovered for a symbol. A split with ratioFrom=1 and ratioTo=2 turns
 * one pre-split unit into two post-split units from {@code effectiveDate} on.
 *
 * <p>Ratios are nullable: a value the discovery source could not parse arrives as null.
 */
@Value
@Builder
public class CorporateAction {

    String symbol;
    CorporateActionType actionType;
    LocalDate effectiveDate;
    BigDecimal ratioFrom;
    BigDecimal ratioTo;
    boolean active;
}
