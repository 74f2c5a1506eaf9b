package com.mailattribution.attribution;

import com.mailattribution.cache.CacheStore;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.codec.PropertyCatalog;
import com.mailattribution.config.AppProperties;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.util.MoneyUtils;
import com.mailattribution.util.Pauses;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Joins campaign revenue with sending-platform campaign metadata by mailing id.
 *
 * <p>Metadata is cached per mailing id, including "not found" answers. Failed lookups are not
 * cached so the next cycle retries them.
 */
@Slf4j
@Service
public class CampaignEnricher implements UnknownPropertyResolver {

    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final IdentifierCodec identifierCodec;
    private final AppProperties.Enrichment enrichmentProperties;
    private final CacheStore<String, Optional<CampaignMetadata>> metadataCache;
    private final AtomicReference<List<CampaignMetadata>> platformCampaigns =
            new AtomicReference<>(List.of());

    public CampaignEnricher(
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            IdentifierCodec identifierCodec,
            AppProperties appProperties,
            Clock clock) {
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.identifierCodec = identifierCodec;
        this.enrichmentProperties = appProperties.getEnrichment();
        this.metadataCache =
                new CacheStore<>(
                        "campaign-metadata", clock, enrichmentProperties.getCampaignCacheTtl());
    }

    /** Stores the campaign list of a sending-platform sync and primes the metadata cache. */
    public void cacheCampaigns(List<CampaignMetadata> campaigns) {
        for (CampaignMetadata campaign : campaigns) {
            if (campaign.getMailingId() != null && !campaign.getMailingId().isEmpty()) {
                metadataCache.put(campaign.getMailingId(), Optional.of(campaign));
            }
        }
        platformCampaigns.set(List.copyOf(campaigns));
        log.info("Cached metadata for {} sending-platform campaigns", campaigns.size());
    }

    /** Campaigns from the latest sending-platform sync. */
    public List<CampaignMetadata> getPlatformCampaigns() {
        return platformCampaigns.get();
    }

    public List<CampaignRevenue> enrich(List<CampaignRevenue> campaigns) {
        Set<String> uncached = new LinkedHashSet<>();
        for (CampaignRevenue campaign : campaigns) {
            String mailingId = campaign.getMailingId();
            if (mailingId != null && !mailingId.isEmpty() && metadataCache.get(mailingId).isEmpty()) {
                uncached.add(mailingId);
            }
        }
        if (!uncached.isEmpty()) {
            log.info("Fetching metadata for {} uncached campaigns", uncached.size());
            for (String mailingId : uncached) {
                lookup(mailingId);
                Pauses.pause(enrichmentProperties.getLookupSpacing(), "Campaign metadata lookup");
            }
        }

        List<CampaignRevenue> enriched = new ArrayList<>(campaigns.size());
        for (CampaignRevenue campaign : campaigns) {
            Optional<CampaignMetadata> metadata =
                    campaign.getMailingId() == null
                            ? Optional.empty()
                            : metadataCache.get(campaign.getMailingId()).flatMap(m -> m);
            enriched.add(metadata.map(m -> apply(campaign, m)).orElse(campaign));
        }
        return enriched;
    }

    private CampaignRevenue apply(CampaignRevenue campaign, CampaignMetadata metadata) {
        CampaignRevenue.CampaignRevenueBuilder builder =
                campaign.toBuilder()
                        .platformLinked(true)
                        .audienceSize(metadata.getAudienceSize())
                        .sent(metadata.getSent())
                        .delivered(metadata.getDelivered())
                        .opens(metadata.getOpens())
                        .uniqueOpens(metadata.getUniqueOpens())
                        .emailClicks(metadata.getEmailClicks())
                        .sendingDomain(metadata.getSendingDomain())
                        .espName(metadata.getEspName())
                        .espConnectionId(metadata.getEspConnectionId())
                        .ecpm(MoneyUtils.perThousand(campaign.getRevenue(), metadata.getDelivered()))
                        .rpm(MoneyUtils.perThousand(campaign.getRevenue(), metadata.getSent()))
                        .revenuePerOpen(MoneyUtils.per(campaign.getRevenue(), metadata.getUniqueOpens()));

        String platformName = metadata.getName();
        if (platformName != null && !platformName.isEmpty()) {
            if (campaign.getCampaignName() == null
                    || campaign.getCampaignName().isEmpty()
                    || campaign.getCampaignName().equals(campaign.getMailingId())) {
                builder.campaignName(platformName);
            }
            PropertyCatalog catalog = identifierCodec.getPropertyCatalog();
            if (!catalog.isKnown(campaign.getPropertyCode())) {
                identifierCodec
                        .propertyFromCampaignName(platformName)
                        .ifPresent(code -> builder.propertyCode(code).propertyName(catalog.nameOf(code)));
            }
        }
        return builder.build();
    }

    /**
     * Resolves property codes from sending-platform campaign names. Cached metadata is used
     * first; at most {@code maxLookups} uncached ids are looked up, spaced by the lookup delay.
     */
    @Override
    public Map<String, String> resolvePropertyCodes(Collection<String> mailingIds) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (mailingIds.isEmpty()) {
            return resolved;
        }

        List<String> uncached = new ArrayList<>();
        for (String mailingId : new LinkedHashSet<>(mailingIds)) {
            Optional<Optional<CampaignMetadata>> cached = metadataCache.get(mailingId);
            if (cached.isPresent()) {
                cached.get()
                        .flatMap(m -> identifierCodec.propertyFromCampaignName(m.getName()))
                        .ifPresent(code -> resolved.put(mailingId, code));
            } else {
                uncached.add(mailingId);
            }
        }
        int fromCache = resolved.size();

        int maxLookups = enrichmentProperties.getMaxLookups();
        if (uncached.size() > maxLookups) {
            log.info("Limiting campaign lookups to {} ({} uncached)", maxLookups, uncached.size());
            uncached = uncached.subList(0, maxLookups);
        }

        for (String mailingId : uncached) {
            Pauses.pause(enrichmentProperties.getLookupSpacing(), "Property code lookup");
            lookup(mailingId)
                    .flatMap(m -> identifierCodec.propertyFromCampaignName(m.getName()))
                    .ifPresent(
                            code -> {
                                resolved.put(mailingId, code);
                                log.debug("Resolved mailing {} to property {}", mailingId, code);
                            });
        }

        log.info(
                "Resolved {} property codes ({} from cache, {} looked up)",
                resolved.size(),
                fromCache,
                uncached.size());
        return resolved;
    }

    private Optional<CampaignMetadata> lookup(String mailingId) {
        Optional<CampaignMetadata> metadata;
        try {
            metadata =
                    sendingPlatformCalls.call(
                            "getCampaign", () -> sendingPlatformClient.getCampaign(mailingId));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Campaign lookup for mailing {} failed: {}", mailingId, e.getMessage());
            return Optional.empty();
        }
        metadataCache.put(mailingId, metadata);
        return metadata;
    }

    public int cachedCampaignCount() {
        return metadataCache.size();
    }

    public void clearCache() {
        metadataCache.clear();
    }
}
