package com.mailattribution.client.sending;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Delivery statistics and routing of one mailing on the sending platform. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignMetadata {
    private String mailingId;
    private String name;
    private long audienceSize;
    private long sent;
    private long delivered;
    private long opens;
    private long uniqueOpens;
    private long emailClicks;
    private String sendingDomain;
    private String espName;
    private String espConnectionId;
    private LocalDate scheduleDate;
}
