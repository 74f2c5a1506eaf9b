package com.mailattribution.client.tracking;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A raw conversion as returned by the tracking network. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRecord {
    private String conversionId;
    private String transactionId;
    private String clickId;
    private String affiliateId;
    private String offerId;
    private String offerName;
    private String status;
    private String eventName;
    @Builder.Default private BigDecimal revenue = BigDecimal.ZERO;
    @Builder.Default private BigDecimal payout = BigDecimal.ZERO;
    private String currency;
    private String sub1;
    private String sub2;
    private String sub3;
    private long conversionUnixTimestamp;
    private long clickUnixTimestamp;
}
