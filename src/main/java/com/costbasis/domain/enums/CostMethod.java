package com.costbasis.domain.enums;

import java.util.Locale;

/** Costing method actually applied to a single sale row. */
public enum CostMethod {
    ACTUAL,
    DEEMED;

    /** Lower-case code used in report output and method counts. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
