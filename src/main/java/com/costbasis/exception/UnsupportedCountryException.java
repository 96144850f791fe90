package com.costbasis.exception;

import java.util.Map;

public class UnsupportedCountryException extends BaseException {

    public UnsupportedCountryException(String countryCode) {
        super(
                ErrorCode.UNSUPPORTED_COUNTRY,
                "Unsupported country_code: " + countryCode,
                Map.of("countryCode", String.valueOf(countryCode)));
    }
}
