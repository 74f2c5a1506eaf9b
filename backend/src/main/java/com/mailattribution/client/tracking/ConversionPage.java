package com.mailattribution.client.tracking;

import java.util.List;
import lombok.Value;

/** One page of conversions; pages are numbered from 1. */
@Value
public class ConversionPage {
    List<ConversionRecord> conversions;
    int page;
    int totalPages;

    public boolean hasNext() {
        return page < totalPages;
    }
}
