package com.mailattribution.model;

import com.mailattribution.codec.OfferType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class OfferPerformance {
    String offerId;
    String offerName;
    OfferType offerType;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal payout;
    BigDecimal conversionRate;
    BigDecimal epc;
}
