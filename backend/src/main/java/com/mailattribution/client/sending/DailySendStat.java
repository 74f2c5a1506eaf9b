package com.mailattribution.client.sending;

import java.time.LocalDate;
import lombok.Value;

@Value
public class DailySendStat {
    LocalDate date;
    long sent;
    long delivered;
}
