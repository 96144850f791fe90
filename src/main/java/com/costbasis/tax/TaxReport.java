package com.costbasis.tax;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Country-neutral capital-gains tax estimate for one tax year.
 *
 * <p>Every {@link TaxCalculator} returns this shape. {@code rows} is null when the request asked
 * for totals only. The figures are an estimate to be validated against the tax authority's own
 * filing guidance; {@code disclaimer} says so in the report itself.
 */
@Value
@Builder
public class TaxReport {

    String countryCode;
    String countryName;
    int taxYear;
    String methodMode;
    String baseCurrency;
    String formulaText;
    List<String> formulaLines;

    /** Number of rows taxed under each method, keyed by {@code actual}/{@code deemed}. */
    Map<String, Integer> methodCounts;

    TaxTotals totals;
    TaxFlags flags;
    CarryforwardSummary carryforward;
    List<TaxReportRow> rows;
    List<String> assumptions;
    String disclaimer;
}
