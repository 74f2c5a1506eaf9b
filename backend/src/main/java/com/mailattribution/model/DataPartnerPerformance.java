package com.mailattribution.model;

import com.mailattribution.volume.VolumeFigure;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Attributed performance of one data partner: CPA from conversions, CPM by click share. */
@Value
@Builder(toBuilder = true)
public class DataPartnerPerformance {
    String partnerPrefix;
    String partnerName;
    String dataSetCode;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal cpaRevenue;
    BigDecimal cpmRevenue;
    BigDecimal payout;
    VolumeFigure volume;
    BigDecimal conversionRate;
    BigDecimal epc;
    List<DataSetMetrics> dataSetBreakdown;
    List<OfferPartnerMetrics> offerBreakdown;
    List<PartnerDailyMetrics> dailySeries;
}
