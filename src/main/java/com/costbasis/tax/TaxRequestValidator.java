package com.costbasis.tax;

import com.costbasis.domain.enums.CostMethodMode;
import com.costbasis.exception.InvalidRequestException;

/** Rejects malformed tax requests before any lot is built. */
public final class TaxRequestValidator {

    static final int MIN_TAX_YEAR = 1900;
    static final int MAX_TAX_YEAR = 2100;

    private TaxRequestValidator() {}

    /**
     * Validates the request and parses its method mode.
     *
     * @return the parsed method mode
     * @throws InvalidRequestException for a missing request or country code, a tax year outside
     *     1900-2100, or an unknown method mode
     */
    public static CostMethodMode validate(TaxReportRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Tax report request is required", "request", null);
        }
        if (request.getCountryCode() == null || request.getCountryCode().isBlank()) {
            throw new InvalidRequestException("country_code is required", "countryCode", request.getCountryCode());
        }
        if (request.getTaxYear() < MIN_TAX_YEAR || request.getTaxYear() > MAX_TAX_YEAR) {
            throw new InvalidRequestException(
                    "tax_year must be between " + MIN_TAX_YEAR + " and " + MAX_TAX_YEAR,
                    "taxYear",
                    request.getTaxYear());
        }
        return CostMethodMode.fromCode(request.getMethodMode());
    }
}
