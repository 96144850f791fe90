package com.costbasis.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the unchecked errors raised at the input boundaries. Each carries the offending values
 * in {@link #getDetails()} (row index, label, country code) so a caller can report them without
 * parsing the message.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** The detail value under {@code key}, or null when the error did not record it. */
    public Object getDetail(String key) {
        return details.get(key);
    }
}
