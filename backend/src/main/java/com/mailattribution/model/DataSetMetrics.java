package com.mailattribution.model;

import com.mailattribution.volume.VolumeFigure;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DataSetMetrics {
    String dataSetCode;
    long clicks;
    long conversions;
    BigDecimal revenue;
    VolumeFigure volume;
    BigDecimal cvr;
    BigDecimal epc;
}
