package com.costbasis.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import lombok.Getter;
import lombok.ToString;

/**
 * An open purchase lot. Owned by exactly one symbol queue inside a
 * {@link com.costbasis.lot.LotLedger}; only the ledger reduces its quantity.
 */
@Getter
@ToString
public class Lot {

    private BigDecimal quantity;
    private final LocalDate acquisitionDate;
    private final BigDecimal grossUnitPrice;
    private final BigDecimal netUnitPrice;

    public Lot(BigDecimal quantity, LocalDate acquisitionDate, BigDecimal grossUnitPrice, BigDecimal netUnitPrice) {
        this.quantity = quantity;
        this.acquisitionDate = acquisitionDate;
        this.grossUnitPrice = grossUnitPrice;
        this.netUnitPrice = netUnitPrice;
    }

    /** Cost-basis price per unit, i.e. the charge-adjusted net price. */
    public BigDecimal getUnitPrice() {
        return netUnitPrice;
    }

    public BigDecimal getCostBasis() {
        return quantity.multiply(netUnitPrice, MathContext.DECIMAL128);
    }

    public Lot copy() {
        return new Lot(quantity, acquisitionDate, grossUnitPrice, netUnitPrice);
    }

    /** Reduces the remaining quantity. Only the owning ledger calls this. */
    public void reduceBy(BigDecimal taken) {
        this.quantity = this.quantity.subtract(taken);
    }
}
