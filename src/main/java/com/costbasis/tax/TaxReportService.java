package com.costbasis.tax;

import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.Trade;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for tax reports: validates the request, resolves the country calculator and
 * delegates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxReportService {

    private final TaxCalculatorRegistry taxCalculatorRegistry;

    /**
     * @throws com.costbasis.exception.InvalidRequestException for a malformed request
     * @throws com.costbasis.exception.UnsupportedCountryException for an unregistered country
     */
    public TaxReport calculate(
            TaxReportRequest request,
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions) {
        TaxRequestValidator.validate(request);
        TaxCalculator calculator = taxCalculatorRegistry.getCalculator(request.getCountryCode());

        TaxReport report = calculator.calculate(request, trades, dailyCharges, corporateActions);

        log.info(
                "Tax report generated: country={}, year={}, mode={}, proceeds={}, taxable={}, tax={}",
                report.getCountryCode(),
                report.getTaxYear(),
                report.getMethodMode(),
                report.getTotals().getProceeds(),
                report.getTotals().getSelectedGainLossAfterAdjustments(),
                report.getTotals().getEstimatedTax());
        return report;
    }

    public List<String> supportedCountries() {
        return taxCalculatorRegistry.supportedCountries();
    }
}
