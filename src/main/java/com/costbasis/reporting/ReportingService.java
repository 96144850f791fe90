package com.costbasis.reporting;

import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.FifoMatchResult;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.RealizedGainRecord;
import com.costbasis.domain.model.Trade;
import com.costbasis.domain.model.UnmatchedSell;
import com.costbasis.lot.FifoMatcher;
import com.costbasis.pnl.PortfolioValuationService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Portfolio views over the FIFO engine, grouped by Indian financial year.
 *
 * <p>Every method takes the full trade, charge and corporate-action snapshot and recomputes from
 * scratch. Live prices are resolved by the caller beforehand (see
 * {@link com.costbasis.service.LivePriceCache}).
 */
@Service
public class ReportingService {

    private static final Logger log = LoggerFactory.getLogger(ReportingService.class);

    private final FifoMatcher fifoMatcher;
    private final PortfolioValuationService portfolioValuationService;

    public ReportingService(FifoMatcher fifoMatcher, PortfolioValuationService portfolioValuationService) {
        this.fifoMatcher = fifoMatcher;
        this.portfolioValuationService = portfolioValuationService;
    }

    /**
     * Builds the dashboard for one financial year: current holdings at live prices, realized P&L and
     * unmatched sells within the FY, data-health issues, and net worth change across the FY.
     *
     * @param fy label such as {@code FY2025}
     * @throws com.costbasis.exception.InvalidRequestException if the label is malformed
     */
    public PortfolioDashboard dashboard(
            String fy,
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            Map<String, BigDecimal> livePrices) {
        LocalDate fyEnd = FinancialYears.end(fy);

        if (trades == null || trades.isEmpty()) {
            return PortfolioDashboard.builder()
                    .fy(fy)
                    .fyList(List.of())
                    .holdings(List.of())
                    .missingChargeDates(List.of())
                    .unmatchedSells(List.of())
                    .skippedCorporateActions(List.of())
                    .realizedPnl(BigDecimal.ZERO)
                    .netWorth(BigDecimal.ZERO)
                    .netWorthYoy(BigDecimal.ZERO)
                    .build();
        }

        FifoMatchResult current = fifoMatcher.match(trades, dailyCharges, corporateActions);
        List<HoldingValuation> holdings = portfolioValuationService.value(current.getHoldings(), livePrices);

        BigDecimal realizedPnl = current.getRealizedGains().stream()
                .filter(r -> FinancialYears.contains(fy, r.getSellDate()))
                .map(RealizedGainRecord::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<UnmatchedSell> fyUnmatched = current.getUnmatchedSells().stream()
                .filter(u -> FinancialYears.contains(fy, u.getSellDate()))
                .collect(Collectors.toList());

        BigDecimal netWorth = holdings.stream()
                .map(HoldingValuation::getCurrentValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        // past holdings are priced at today's quotes, so they must be in today's split units
        Map<String, List<Lot>> atFyEnd =
                fifoMatcher.holdingsAsOfInCurrentUnits(trades, dailyCharges, corporateActions, fyEnd);
        Map<String, List<Lot>> atPreviousFyEnd = fifoMatcher.holdingsAsOfInCurrentUnits(
                trades, dailyCharges, corporateActions, fyEnd.minusYears(1));
        BigDecimal netWorthYoy = portfolioValuationService
                .netWorth(atFyEnd, livePrices)
                .subtract(portfolioValuationService.netWorth(atPreviousFyEnd, livePrices));

        List<LocalDate> missingChargeDates = missingChargeDates(trades, dailyCharges);
        if (!missingChargeDates.isEmpty()) {
            log.warn("{} trade dates have no contract-note charges", missingChargeDates.size());
        }

        return PortfolioDashboard.builder()
                .fy(fy)
                .fyList(fyList(trades))
                .holdings(holdings)
                .missingChargeDates(missingChargeDates)
                .unmatchedSells(fyUnmatched)
                .skippedCorporateActions(current.getSkippedCorporateActions())
                .realizedPnl(realizedPnl.setScale(2, RoundingMode.HALF_UP))
                .netWorth(netWorth)
                .netWorthYoy(netWorthYoy)
                .build();
    }

    /** Realized gain records of sells within the financial year. */
    public RealizedGainsReport realizedGains(
            String fy,
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions) {
        FinancialYears.validate(fy);
        List<RealizedGainRecord> rows = fifoMatcher.match(trades, dailyCharges, corporateActions)
                .getRealizedGains()
                .stream()
                .filter(r -> FinancialYears.contains(fy, r.getSellDate()))
                .collect(Collectors.toList());
        BigDecimal total = rows.stream()
                .map(RealizedGainRecord::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        return new RealizedGainsReport(fy, rows, total);
    }

    /**
     * Net worth at every FY end covered by the trades (valued at the given live prices, falling back
     * to cost) and total charges within each FY. Past holdings are split-adjusted to current units.
     */
    public PortfolioSummary summary(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            Map<String, BigDecimal> livePrices) {
        List<PortfolioSummary.FyAmount> netWorthByFy = new ArrayList<>();
        List<PortfolioSummary.FyAmount> chargesByFy = new ArrayList<>();

        for (String fy : fyList(trades)) {
            Map<String, List<Lot>> holdings = fifoMatcher.holdingsAsOfInCurrentUnits(
                    trades, dailyCharges, corporateActions, FinancialYears.end(fy));
            netWorthByFy.add(new PortfolioSummary.FyAmount(fy, portfolioValuationService.netWorth(holdings, livePrices)));

            BigDecimal charges = dailyCharges == null
                    ? BigDecimal.ZERO
                    : dailyCharges.stream()
                            .filter(c -> c.getDate() != null && FinancialYears.contains(fy, c.getDate()))
                            .map(DailyChargeAggregate::getTotalCharges)
                            .reduce(BigDecimal.ZERO, BigDecimal::add);
            chargesByFy.add(new PortfolioSummary.FyAmount(fy, charges.setScale(2, RoundingMode.HALF_UP)));
        }

        return new PortfolioSummary(netWorthByFy, chargesByFy);
    }

    /** Sorted distinct FY labels of the trade dates. A null trade list has none. */
    public List<String> fyList(List<Trade> trades) {
        if (trades == null) {
            return List.of();
        }
        Set<String> labels = new TreeSet<>();
        trades.forEach(t -> labels.add(FinancialYears.label(t.getDate())));
        return new ArrayList<>(labels);
    }

    /** Trade dates with no matching charge aggregate, sorted. */
    public List<LocalDate> missingChargeDates(List<Trade> trades, List<DailyChargeAggregate> dailyCharges) {
        if (trades == null) {
            return List.of();
        }
        Set<LocalDate> chargeDates = dailyCharges == null
                ? Set.of()
                : dailyCharges.stream()
                        .map(DailyChargeAggregate::getDate)
                        .filter(d -> d != null)
                        .collect(Collectors.toSet());
        return trades.stream()
                .map(Trade::getDate)
                .filter(d -> !chargeDates.contains(d))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }
}
