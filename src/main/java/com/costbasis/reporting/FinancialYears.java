package com.costbasis.reporting;

import com.costbasis.exception.InvalidRequestException;
import java.time.LocalDate;
import java.time.Month;

/**
 * Indian financial-year labels used by the portfolio reports. {@code FY2025} runs from
 * April 1, 2024 to March 31, 2025.
 */
public final class FinancialYears {

    private static final String PREFIX = "FY";

    private FinancialYears() {}

    public static String label(LocalDate date) {
        int endYear = date.getMonthValue() >= Month.APRIL.getValue() ? date.getYear() + 1 : date.getYear();
        return PREFIX + endYear;
    }

    /** First day of the financial year, e.g. 2024-04-01 for {@code FY2025}. */
    public static LocalDate start(String label) {
        return LocalDate.of(endYear(label) - 1, Month.APRIL, 1);
    }

    /** Last day of the financial year, e.g. 2025-03-31 for {@code FY2025}. */
    public static LocalDate end(String label) {
        return LocalDate.of(endYear(label), Month.MARCH, 31);
    }

    /** @throws InvalidRequestException if the label is not of the form {@code FY<year>} */
    public static void validate(String label) {
        endYear(label);
    }

    public static boolean contains(String label, LocalDate date) {
        return label(date).equals(label);
    }

    private static int endYear(String label) {
        if (label == null || !label.startsWith(PREFIX)) {
            throw new InvalidRequestException("FY must be like FY2025", "fy", label);
        }
        try {
            return Integer.parseInt(label.substring(PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("FY must be like FY2025", "fy", label);
        }
    }
}
