package com.mailattribution.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** An offer with its revenue split across data partners. */
@Value
@Builder(toBuilder = true)
public class OfferPartnerBreakdown {
    String offerId;
    String offerName;
    boolean cpm;
    long totalClicks;
    long totalConversions;
    BigDecimal totalRevenue;
    List<PartnerShare> partners;
}
