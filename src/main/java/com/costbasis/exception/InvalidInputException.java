package com.costbasis.exception;

import java.util.Map;

/**
 * Raised when trade data handed to the core is missing a required field.
 * Thrown before any lot is built, so callers never see a partial result.
 */
public class InvalidInputException extends BaseException {

    /** @param row zero-based index of the rejected tradebook row */
    public InvalidInputException(String message, int row) {
        super(ErrorCode.INVALID_INPUT, message, Map.of("row", row));
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_INPUT, message, details);
    }
}
