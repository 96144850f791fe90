package com.costbasis.domain.model;

import lombok.Value;

/** A corporate action the adjuster refused to apply, with the reason. Never fatal. */
@Value
public class SkippedCorporateAction {

    public enum Reason {
        INVALID_RATIO,
        MISSING_EFFECTIVE_DATE,
        MISSING_SYMBOL,
        UNSUPPORTED_TYPE
    }

    CorporateAction action;
    Reason reason;
}
