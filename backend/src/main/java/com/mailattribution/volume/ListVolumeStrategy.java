package com.mailattribution.volume;

import com.mailattribution.cache.DateRange;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.ListInfo;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.DataSetCodes;
import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Volume from sends grouped by list, keyed by list name. List names do not reliably follow the
 * data-set convention, so the result is trusted for totals but not for per-partner splits.
 */
@Slf4j
@Component
@Order(3)
public class ListVolumeStrategy implements VolumeStrategy {

    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final Clock clock;

    public ListVolumeStrategy(
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            Clock clock) {
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "list";
    }

    @Override
    public Optional<VolumeResult> resolve(DateRange range) {
        List<ListInfo> lists = sendingPlatformCalls.call("getLists", sendingPlatformClient::getLists);
        List<SendReportRow> rows =
                sendingPlatformCalls.call(
                        "getSendsByList",
                        () -> sendingPlatformClient.getSendsByList(range.getFrom(), range.getTo()));

        Map<String, Long> sends = sendsByDataSet(lists, rows);
        if (sends.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                VolumeResult.builder()
                        .sendsByDataSet(sends)
                        .source(VolumeSource.LIST)
                        .perPartnerUsable(false)
                        .resolvedAt(clock.instant())
                        .build());
    }

    /** Joins list metadata with sends by list id; names are trimmed and upper-cased. */
    public static Map<String, Long> sendsByDataSet(List<ListInfo> lists, List<SendReportRow> rows) {
        Map<String, String> namesById = new HashMap<>();
        for (ListInfo list : lists) {
            namesById.put(list.getId(), list.getName());
        }

        Map<String, Long> result = new LinkedHashMap<>();
        for (SendReportRow row : rows) {
            String listId = row.getId();
            if (listId == null || listId.isBlank() || "0".equals(listId) || row.getSent() == 0) {
                continue;
            }
            String name = namesById.get(listId);
            if (name == null || name.isEmpty()) {
                continue;
            }
            String code = DataSetCodes.trimTrailingUnderscores(name.trim());
            if (code.isEmpty()) {
                continue;
            }
            result.merge(code.toUpperCase(Locale.ROOT), row.getSent(), Long::sum);
        }
        return Collections.unmodifiableMap(result);
    }
}
