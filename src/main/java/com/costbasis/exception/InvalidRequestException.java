package com.costbasis.exception;

import java.util.Map;

/** A tax or report request with parameters outside the accepted range. */
public class InvalidRequestException extends BaseException {

    /**
     * @param field name of the rejected request parameter
     * @param value the rejected value, recorded as text ("null" when absent)
     */
    public InvalidRequestException(String message, String field, Object value) {
        super(ErrorCode.INVALID_REQUEST, message, Map.of(field, String.valueOf(value)));
    }
}
