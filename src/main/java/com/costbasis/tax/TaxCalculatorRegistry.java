package com.costbasis.tax;

import com.costbasis.exception.UnsupportedCountryException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link TaxCalculator} by country code.
 *
 * <p>Spring injects every TaxCalculator bean and this registry indexes them by upper-cased code at
 * construction time. Lookups trim and upper-case the requested code.
 */
@Component
public class TaxCalculatorRegistry {

    private final Map<String, TaxCalculator> calculatorsByCountry;

    public TaxCalculatorRegistry(List<TaxCalculator> taxCalculators) {
        this.calculatorsByCountry = taxCalculators.stream()
                .collect(Collectors.toMap(
                        calculator -> calculator.getCountryCode().toUpperCase(Locale.ROOT), Function.identity()));
    }

    /**
     * Returns the calculator for the given country.
     *
     * @throws UnsupportedCountryException if no calculator is registered for the code
     */
    public TaxCalculator getCalculator(String countryCode) {
        String code = countryCode == null ? "" : countryCode.trim().toUpperCase(Locale.ROOT);
        TaxCalculator calculator = calculatorsByCountry.get(code);
        if (calculator == null) {
            throw new UnsupportedCountryException(countryCode);
        }
        return calculator;
    }

    /** Registered country codes, sorted. */
    public List<String> supportedCountries() {
        List<String> codes = new ArrayList<>(calculatorsByCountry.keySet());
        Collections.sort(codes);
        return codes;
    }
}
