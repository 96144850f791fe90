package com.costbasis.domain.enums;

import com.costbasis.exception.InvalidRequestException;
import java.util.Locale;

/**
 * Which costing method a tax report uses per sale.
 *
 * <p>{@link #AUTO_BEST_PER_SALE} compares actual and deemed cost on every sale row and keeps
 * the lower taxable gain for that row. It is a per-row minimization, not a single choice for
 * the whole year.
 */
public enum CostMethodMode {
    ACTUAL("actual"),
    DEEMED("deemed"),
    AUTO_BEST_PER_SALE("auto_best_per_sale");

    private final String code;

    CostMethodMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses the request code. A null or blank value means {@link #AUTO_BEST_PER_SALE}.
     *
     * @throws InvalidRequestException if the code is not one of the recognized modes
     */
    public static CostMethodMode fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO_BEST_PER_SALE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CostMethodMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidRequestException(
                "method_mode must be one of: actual, deemed, auto_best_per_sale", "methodMode", raw);
    }
}
