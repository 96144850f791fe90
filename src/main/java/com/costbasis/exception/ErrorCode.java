package com.costbasis.exception;

/** Failure categories a caller can branch on without parsing messages. */
public enum ErrorCode {
    /** Trade data is missing a required field; the whole batch is rejected. */
    INVALID_INPUT,
    /** Report parameters are malformed or out of range. */
    INVALID_REQUEST,
    /** No tax calculator is registered for the country. */
    UNSUPPORTED_COUNTRY
}
