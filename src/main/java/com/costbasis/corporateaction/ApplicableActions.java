package com.costbasis.corporateaction;

import com.costbasis.domain.model.CorporateAction;
import com.costbasis.domain.model.SkippedCorporateAction;
import java.util.List;
import lombok.Value;

@Value
public class ApplicableActions {

    /** Active, valid splits sorted by effective date. */
    List<CorporateAction> splits;

    List<SkippedCorporateAction> skipped;
}
