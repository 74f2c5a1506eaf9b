package com.mailattribution.client.tracking;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A raw click as returned by the tracking network. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClickRecord {
    private String clickId;
    private String transactionId;
    private String affiliateId;
    private String offerId;
    private String offerName;
    private String sub1;
    private String sub2;
    private String sub3;
    private String timestamp;
    private boolean failed;
}
