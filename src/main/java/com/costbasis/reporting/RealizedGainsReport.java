package com.costbasis.reporting;

import com.costbasis.domain.model.RealizedGainRecord;
import java.math.BigDecimal;
import java.util.List;
import lombok.Value;

@Value
public class RealizedGainsReport {

    String fy;
    List<RealizedGainRecord> rows;
    BigDecimal totalRealizedPnl;
}
