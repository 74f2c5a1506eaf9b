package com.mailattribution.attribution;

import com.mailattribution.model.EspRevenuePerformance;
import com.mailattribution.model.ReconciliationReport;
import java.util.List;
import lombok.Value;

@Value
public class EspReconciliation {
    List<EspRevenuePerformance> entries;
    ReconciliationReport report;
}
