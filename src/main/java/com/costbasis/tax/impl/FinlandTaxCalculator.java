package com.costbasis.tax.impl;

import com.costbasis.config.FinlandTaxConfig;
import com.costbasis.corporateaction.CorporateActionAdjuster;
import com.costbasis.domain.enums.CostMethod;
import com.costbasis.domain.enums.CostMethodMode;
import com.costbasis.domain.model.AllocatedTrade;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.DailyChargeAggregate;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.LotConsumption;
import com.costbasis.domain.model.LotConsumptionResult;
import com.costbasis.domain.model.Trade;
import com.costbasis.lot.LotLedger;
import com.costbasis.lot.SplitSchedule;
import com.costbasis.pnl.ChargeAllocator;
import com.costbasis.tax.CarryforwardSummary;
import com.costbasis.tax.TaxCalculator;
import com.costbasis.tax.TaxFlags;
import com.costbasis.tax.TaxReport;
import com.costbasis.tax.TaxReportRequest;
import com.costbasis.tax.TaxReportRow;
import com.costbasis.tax.TaxRequestValidator;
import com.costbasis.tax.TaxTotals;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finnish capital-gains estimate for listed shares.
 *
 * <p>Per sale, both methods allowed by Finnish rules are computed:
 * <ul>
 *   <li><b>Actual:</b> proceeds - (acquisition cost + transfer tax + deductible expenses), where the
 *       expenses are the contract-note charges allocated to the buy and sell legs</li>
 *   <li><b>Deemed:</b> proceeds - 20% of proceeds, or 40% when the shares were held at least
 *       10 years</li>
 * </ul>
 * {@code auto_best_per_sale} keeps the lower of the two on every row independently. Whether mixing
 * methods within one filing is acceptable should be confirmed against Vero guidance.
 *
 * <p>Year rules, in order: small-sales exemption (total proceeds at or below 1000 makes the year
 * non-taxable and a loss non-deductible), then loss carryforward, then the progressive capital
 * income rate (30% up to 30 000, 34% above).
 *
 * <p>Tax year is the calendar year. Lots are matched FIFO by (date, tradeId) across the whole
 * history so sales in earlier years consume the right lots.
 */
@Component
public class FinlandTaxCalculator implements TaxCalculator {

    private static final Logger log = LoggerFactory.getLogger(FinlandTaxCalculator.class);

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365.25");

    static final String DISCLAIMER = "Estimate only. Use as a reporting aid and validate final values against "
            + "official Vero instructions/forms for your filing year and edge cases.";

    private static final List<String> FORMULA_LINES = List.of(
            "Actual method: Selling price - (Acquisition cost + transfer tax + deductible expenses)",
            "Deemed method: Selling price - (20% or 40% deemed acquisition cost)");

    private final ChargeAllocator chargeAllocator;
    private final CorporateActionAdjuster corporateActionAdjuster;
    private final FinlandTaxConfig finlandTaxConfig;

    public FinlandTaxCalculator(
            ChargeAllocator chargeAllocator,
            CorporateActionAdjuster corporateActionAdjuster,
            FinlandTaxConfig finlandTaxConfig) {
        this.chargeAllocator = chargeAllocator;
        this.corporateActionAdjuster = corporateActionAdjuster;
        this.finlandTaxConfig = finlandTaxConfig;
    }

    @Override
    public String getCountryCode() {
        return "FI";
    }

    @Override
    public String getCountryName() {
        return "Finland";
    }

    @Override
    public TaxReport calculate(
            TaxReportRequest request,
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions) {
        CostMethodMode mode = TaxRequestValidator.validate(request);
        BigDecimal priorLoss = nonNegative(request.getPriorLossCarryforward());

        if (trades == null || trades.isEmpty()) {
            return emptyReport(request, mode, priorLoss);
        }

        List<TaxReportRow> allRows = calculateRows(trades, dailyCharges, corporateActions, mode);
        List<TaxReportRow> rows = allRows.stream()
                .filter(r -> r.getSellDate().getYear() == request.getTaxYear())
                .collect(Collectors.toList());

        BigDecimal totalProceeds = sum(rows, TaxReportRow::getProceeds);
        BigDecimal totalActual = sum(rows, TaxReportRow::getActualTaxableGainLoss);
        BigDecimal totalDeemed = sum(rows, TaxReportRow::getDeemedTaxableGainLoss);
        BigDecimal totalSelected = sum(rows, TaxReportRow::getSelectedTaxableGainLoss);

        boolean exempt = totalProceeds.compareTo(finlandTaxConfig.getSmallSalesThreshold()) <= 0;
        boolean lossNonDeductible = false;
        BigDecimal lossUsed = BigDecimal.ZERO;
        BigDecimal lossToCarry = priorLoss;
        BigDecimal taxable = totalSelected;
        BigDecimal estimatedTax = BigDecimal.ZERO;

        if (exempt) {
            taxable = BigDecimal.ZERO;
            lossNonDeductible = totalSelected.signum() < 0;
        } else {
            if (taxable.signum() > 0 && priorLoss.signum() > 0) {
                lossUsed = priorLoss.min(taxable);
                taxable = taxable.subtract(lossUsed);
                lossToCarry = priorLoss.subtract(lossUsed);
            } else if (taxable.signum() <= 0) {
                lossToCarry = priorLoss.add(taxable.abs());
            }
            estimatedTax = progressiveTax(taxable);
        }

        Map<String, Integer> methodCounts = emptyMethodCounts();
        rows.forEach(r -> methodCounts.merge(r.getSelectedMethod().code(), 1, Integer::sum));

        log.info(
                "Finland {}: {} sales, proceeds={}, selected={}, exempt={}, tax={}",
                request.getTaxYear(),
                rows.size(),
                totalProceeds,
                totalSelected,
                exempt,
                estimatedTax);

        return TaxReport.builder()
                .countryCode(getCountryCode())
                .countryName(getCountryName())
                .taxYear(request.getTaxYear())
                .methodMode(mode.getCode())
                .baseCurrency(request.getBaseCurrency())
                .formulaText(String.join(". ", FORMULA_LINES) + ".")
                .formulaLines(FORMULA_LINES)
                .methodCounts(methodCounts)
                .totals(TaxTotals.builder()
                        .proceeds(money(totalProceeds))
                        .actualGainLoss(money(totalActual))
                        .deemedGainLoss(money(totalDeemed))
                        .selectedGainLossBeforeAdjustments(money(totalSelected))
                        .selectedGainLossAfterAdjustments(money(taxable))
                        .estimatedTax(money(estimatedTax))
                        .build())
                .flags(new TaxFlags(exempt, lossNonDeductible))
                .carryforward(new CarryforwardSummary(
                        money(priorLoss), money(lossUsed), money(lossToCarry.max(BigDecimal.ZERO))))
                .rows(request.isIncludeRows() ? List.copyOf(rows) : null)
                .assumptions(List.of(
                        "Finland tax year is calendar year.",
                        "FIFO lot matching is used.",
                        "Daily charges from contract notes are allocated by turnover across trades on the same date.",
                        "Transfer tax is set to 0 unless provided separately in source data.",
                        "Auto mode compares methods on each sale row and picks the lower taxable gain/loss for that row.",
                        finlandTaxConfig.isApplyCorporateActions()
                                ? "Stock splits rescale earlier lots from their effective date."
                                : "Corporate actions are not applied; tradebook quantities and prices are used as-is."))
                .disclaimer(DISCLAIMER)
                .build();
    }

    /**
     * Replays the whole history and returns one row per SELL that matched at least one lot, in
     * replay order. Rows are not filtered by year.
     */
    public List<TaxReportRow> calculateRows(
            List<Trade> trades,
            List<DailyChargeAggregate> dailyCharges,
            List<CorporateAction> corporateActions,
            CostMethodMode mode) {
        List<AllocatedTrade> ordered = new ArrayList<>(chargeAllocator.allocate(trades, dailyCharges));
        ordered.sort(Comparator.comparing((AllocatedTrade a) -> a.getTrade().getDate())
                .thenComparing(a -> a.getTrade().getTradeId(), Comparator.nullsFirst(Comparator.<String>naturalOrder())));

        LotLedger ledger = new LotLedger(LotLedger.TAX_EPSILON);
        SplitSchedule splitSchedule = finlandTaxConfig.isApplyCorporateActions()
                ? new SplitSchedule(
                        corporateActionAdjuster.applicableActions(corporateActions).getSplits(),
                        corporateActionAdjuster)
                : new SplitSchedule(List.of(), corporateActionAdjuster);

        List<TaxReportRow> rows = new ArrayList<>();
        int tradeIndex = 0;

        for (AllocatedTrade allocated : ordered) {
            Trade trade = allocated.getTrade();
            String symbol = trade.getSymbol();
            splitSchedule.applyDue(ledger, symbol, trade.getDate());

            if (trade.isBuy()) {
                ledger.addLot(
                        symbol,
                        new Lot(trade.getQuantity(), trade.getDate(), trade.getPrice(), allocated.getNetPrice()));
                continue;
            }

            LotConsumptionResult consumed = ledger.consume(symbol, trade.getQuantity());
            if (consumed.getConsumptions().isEmpty()) {
                log.debug("Sale {} of {} on {} matched no lots, no tax row", trade.getTradeId(), symbol, trade.getDate());
                tradeIndex++;
                continue;
            }

            rows.add(buildRow(trade, allocated.getNetPrice(), consumed, mode, tradeIndex));
            tradeIndex++;
        }
        return rows;
    }

    private TaxReportRow buildRow(
            Trade trade, BigDecimal netSellPrice, LotConsumptionResult consumed, CostMethodMode mode, int tradeIndex) {
        BigDecimal grossSellPrice = trade.getPrice();
        BigDecimal sellChargePerUnit = grossSellPrice.subtract(netSellPrice).max(BigDecimal.ZERO);
        LocalDate sellDate = trade.getDate();

        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal acquisitionCost = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal deemedCost = BigDecimal.ZERO;
        BigDecimal weightedYears = BigDecimal.ZERO;
        BigDecimal matchedQty = BigDecimal.ZERO;

        for (LotConsumption slice : consumed.getConsumptions()) {
            BigDecimal take = slice.getQuantity();
            BigDecimal sliceProceeds = grossSellPrice.multiply(take, MC);
            BigDecimal buyCharge = slice.getNetUnitPrice()
                    .subtract(slice.getGrossUnitPrice())
                    .multiply(take, MC)
                    .max(BigDecimal.ZERO);

            proceeds = proceeds.add(sliceProceeds, MC);
            acquisitionCost = acquisitionCost.add(slice.getGrossUnitPrice().multiply(take, MC), MC);
            expenses = expenses.add(buyCharge, MC).add(sellChargePerUnit.multiply(take, MC), MC);
            deemedCost = deemedCost.add(
                    sliceProceeds.multiply(deemedRate(slice.getAcquisitionDate(), sellDate), MC), MC);
            weightedYears = weightedYears.add(
                    holdingYears(slice.getAcquisitionDate(), sellDate).multiply(take, MC), MC);
            matchedQty = matchedQty.add(take, MC);
        }

        BigDecimal actualGain = proceeds.subtract(acquisitionCost.add(expenses, MC), MC);
        BigDecimal deemedGain = proceeds.subtract(deemedCost, MC);

        CostMethod selectedMethod;
        switch (mode) {
            case ACTUAL:
                selectedMethod = CostMethod.ACTUAL;
                break;
            case DEEMED:
                selectedMethod = CostMethod.DEEMED;
                break;
            default:
                selectedMethod = deemedGain.compareTo(actualGain) < 0 ? CostMethod.DEEMED : CostMethod.ACTUAL;
                break;
        }
        BigDecimal selectedGain = selectedMethod == CostMethod.DEEMED ? deemedGain : actualGain;

        BigDecimal effectiveRate = proceeds.signum() > 0 ? deemedCost.divide(proceeds, MC) : BigDecimal.ZERO;
        String saleId = trade.getTradeId() != null && !trade.getTradeId().isBlank()
                ? trade.getTradeId()
                : trade.getSymbol() + "-" + sellDate + "-" + tradeIndex;

        return TaxReportRow.builder()
                .saleId(saleId)
                .symbol(trade.getSymbol())
                .sellDate(sellDate)
                .sellQty(matchedQty.setScale(4, RoundingMode.HALF_UP))
                .proceeds(money(proceeds))
                .actualAcquisitionCost(money(acquisitionCost))
                .transferTax(money(BigDecimal.ZERO))
                .deductibleExpenses(money(expenses))
                .actualTaxableGainLoss(money(actualGain))
                .deemedRateEffective(effectiveRate.setScale(4, RoundingMode.HALF_UP))
                .deemedCost(money(deemedCost))
                .deemedTaxableGainLoss(money(deemedGain))
                .selectedMethod(selectedMethod)
                .selectedTaxableGainLoss(money(selectedGain))
                .avgHoldingYears(weightedYears.divide(matchedQty, MC).setScale(3, RoundingMode.HALF_UP))
                .build();
    }

    /**
     * True when {@code sellDate} is on or after the long-holding anniversary of {@code buyDate}.
     * {@link LocalDate#plusYears(long)} maps a Feb-29 buy date to Feb-28 in a non-leap target year.
     */
    public boolean heldAtLeastLongHoldingPeriod(LocalDate buyDate, LocalDate sellDate) {
        if (sellDate.isBefore(buyDate)) {
            return false;
        }
        LocalDate anniversary = buyDate.plusYears(finlandTaxConfig.getLongHoldingYears());
        return !sellDate.isBefore(anniversary);
    }

    public BigDecimal deemedRate(LocalDate buyDate, LocalDate sellDate) {
        return heldAtLeastLongHoldingPeriod(buyDate, sellDate)
                ? finlandTaxConfig.getDeemedRateLong()
                : finlandTaxConfig.getDeemedRateShort();
    }

    /** Progressive capital income tax on a post-carryforward taxable amount. Zero for non-positive input. */
    public BigDecimal progressiveTax(BigDecimal taxable) {
        if (taxable.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal limit = finlandTaxConfig.getLowerBandLimit();
        BigDecimal lowerBand = taxable.min(limit).multiply(finlandTaxConfig.getLowerBandRate(), MC);
        BigDecimal upperBand = taxable.subtract(limit).max(BigDecimal.ZERO)
                .multiply(finlandTaxConfig.getUpperBandRate(), MC);
        return lowerBand.add(upperBand, MC);
    }

    private static BigDecimal holdingYears(LocalDate buyDate, LocalDate sellDate) {
        long days = Math.max(0, ChronoUnit.DAYS.between(buyDate, sellDate));
        return BigDecimal.valueOf(days).divide(DAYS_PER_YEAR, MC);
    }

    private TaxReport emptyReport(TaxReportRequest request, CostMethodMode mode, BigDecimal priorLoss) {
        return TaxReport.builder()
                .countryCode(getCountryCode())
                .countryName(getCountryName())
                .taxYear(request.getTaxYear())
                .methodMode(mode.getCode())
                .baseCurrency(request.getBaseCurrency())
                .formulaText("Capital gain/loss is calculated per sale, then aggregated for calendar year.")
                .formulaLines(FORMULA_LINES)
                .methodCounts(emptyMethodCounts())
                .totals(TaxTotals.zero())
                .flags(new TaxFlags(false, false))
                .carryforward(new CarryforwardSummary(money(priorLoss), money(BigDecimal.ZERO), money(priorLoss)))
                .rows(request.isIncludeRows() ? List.of() : null)
                .assumptions(List.of("Finland tax year is calendar year.", "No sales found for selected year."))
                .disclaimer(DISCLAIMER)
                .build();
    }

    private static Map<String, Integer> emptyMethodCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(CostMethod.ACTUAL.code(), 0);
        counts.put(CostMethod.DEEMED.code(), 0);
        return counts;
    }

    private static BigDecimal sum(List<TaxReportRow> rows, Function<TaxReportRow, BigDecimal> field) {
        return rows.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value.max(BigDecimal.ZERO);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
