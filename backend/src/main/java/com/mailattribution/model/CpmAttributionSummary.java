package com.mailattribution.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of splitting CPM offer revenue across partners by click share. */
@Value
@Builder(toBuilder = true)
public class CpmAttributionSummary {
    int cpmOfferCount;
    BigDecimal totalCpmRevenue;
    BigDecimal attributedRevenue;
    BigDecimal unattributedRevenue;
    List<String> zeroClickOfferIds;
}
