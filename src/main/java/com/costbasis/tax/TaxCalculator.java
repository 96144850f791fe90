package com.costbasis.tax;

import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.Trade;
import java.util.List;

/**
 * Capital-gains tax rules of one country.
 *
 * <p>Implementations are Spring beans and are picked up by {@link TaxCalculatorRegistry}; adding a
 * country means adding a bean. Each implementation runs its own FIFO pass over the raw inputs under
 * its own charge and corporate-action rules, so a report never depends on prices adjusted elsewhere.
 *
 * <p>Implementations must be stateless: every call owns its lot state.
 */
public interface TaxCalculator {

    /** Upper-case ISO alpha-2 style code, e.g. {@code FI}. */
    String getCountryCode();

    String getCountryName();

    /**
     * Calculates the report for {@code request.taxYear}. Trades from all years are needed because
     * earlier buys and sells determine which lots a sale in the tax year consumes.
     *
     * @param request          validated or raw request; implementations re-validate
     * @param trades           full trade history
     * @param dailyCharges     daily contract-note charge aggregates
     * @param corporateActions split records for the traded symbols
     * @return the report
     */
    TaxReport calculate(
            TaxReportRequest request,
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions);
}
