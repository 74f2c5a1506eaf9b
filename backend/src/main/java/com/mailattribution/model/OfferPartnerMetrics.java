package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One offer's contribution to a data partner. */
@Value
@Builder(toBuilder = true)
public class OfferPartnerMetrics {
    String offerId;
    String offerName;
    boolean cpm;
    long clicks;
    long conversions;
    BigDecimal revenue;
}
