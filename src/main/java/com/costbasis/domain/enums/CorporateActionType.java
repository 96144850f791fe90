package com.costbasis.domain.enums;

/**
 * Kinds of corporate action the data model can carry.
 * Only {@link #SPLIT} is consumed by the lot adjuster; the rest are recorded but skipped.
 */
public enum CorporateActionType {
    SPLIT,
    BONUS,
    MERGER
}
