package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** The part of one lot taken by a sell. */
@Value
public class LotConsumption {

    LocalDate acquisitionDate;
    BigDecimal grossUnitPrice;
    BigDecimal netUnitPrice;
    BigDecimal quantity;
}
