package com.costbasis.corporateaction;

import com.costbasis.domain.enums.CorporateActionType;
import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.Lot;
import com.costbasis.domain.model.SkippedCorporateAction;
import com.costbasis.domain.model.SkippedCorporateAction.Reason;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rescales historical lots when a stock split becomes effective.
 *
 * <p>For every lot acquired strictly before the effective date:
 * <pre>
 *   factor    = ratioTo / ratioFrom
 *   quantity  = quantity * factor
 *   unitPrice = unitPrice / factor     (gross and net)
 * </pre>
 * so the lot's total cost is unchanged.
 *
 * <p>The adjuster keeps no record of what it has already applied. Feeding it the same action twice
 * scales twice; callers must drive it from an unadjusted lot history, which the FIFO matcher does by
 * rebuilding lots from the full trade stream on every call.
 *
 * <p>BONUS and MERGER actions are part of the data model but are not consumed here; they are
 * reported as skipped.
 */
@Slf4j
@Component
public class CorporateActionAdjuster {

    private static final MathContext MC = MathContext.DECIMAL128;

    /**
     * Returns adjusted copies of the lots. Lots on or after the effective date are copied unchanged.
     * The caller must have validated the action with {@link #validate(CorporateAction)}.
     */
    public List<Lot> adjust(List<Lot> lots, CorporateAction action) {
        BigDecimal factor = action.getRatioTo().divide(action.getRatioFrom(), MC);
        List<Lot> adjusted = new ArrayList<>(lots.size());
        int rescaled = 0;

        for (Lot lot : lots) {
            if (lot.getAcquisitionDate().isBefore(action.getEffectiveDate())) {
                adjusted.add(new Lot(
                        lot.getQuantity().multiply(factor, MC),
                        lot.getAcquisitionDate(),
                        lot.getGrossUnitPrice().divide(factor, MC),
                        lot.getNetUnitPrice().divide(factor, MC)));
                rescaled++;
            } else {
                adjusted.add(lot.copy());
            }
        }

        log.debug(
                "Applied {} {}:{} effective {} to {} of {} lots",
                action.getSymbol(),
                action.getRatioFrom(),
                action.getRatioTo(),
                action.getEffectiveDate(),
                rescaled,
                lots.size());
        return adjusted;
    }

    /**
     * Checks whether an action can be applied.
     *
     * @return the skip diagnostic, or empty if the action is a usable split
     */
    public Optional<SkippedCorporateAction> validate(CorporateAction action) {
        if (action.getActionType() != CorporateActionType.SPLIT) {
            return Optional.of(new SkippedCorporateAction(action, Reason.UNSUPPORTED_TYPE));
        }
        if (action.getSymbol() == null || action.getSymbol().isBlank()) {
            return Optional.of(new SkippedCorporateAction(action, Reason.MISSING_SYMBOL));
        }
        if (action.getEffectiveDate() == null) {
            return Optional.of(new SkippedCorporateAction(action, Reason.MISSING_EFFECTIVE_DATE));
        }
        if (!isPositive(action.getRatioFrom()) || !isPositive(action.getRatioTo())) {
            return Optional.of(new SkippedCorporateAction(action, Reason.INVALID_RATIO));
        }
        return Optional.empty();
    }

    /**
     * Partitions actions into the applicable splits, in ascending effective-date order, and the
     * skipped ones. Inactive actions are ignored without a diagnostic.
     */
    public ApplicableActions applicableActions(List<CorporateAction> actions) {
        List<CorporateAction> applicable = new ArrayList<>();
        List<SkippedCorporateAction> skipped = new ArrayList<>();
        if (actions == null) {
            return new ApplicableActions(applicable, skipped);
        }

        for (CorporateAction action : actions) {
            if (action == null || !action.isActive()) {
                continue;
            }
            Optional<SkippedCorporateAction> skip = validate(action);
            if (skip.isPresent()) {
                log.warn(
                        "Skipping corporate action {} {} effective {}: {}",
                        action.getSymbol(),
                        action.getActionType(),
                        action.getEffectiveDate(),
                        skip.get().getReason());
                skipped.add(skip.get());
            } else {
                applicable.add(action);
            }
        }

        applicable.sort(Comparator.comparing(CorporateAction::getEffectiveDate));
        return new ApplicableActions(applicable, skipped);
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
