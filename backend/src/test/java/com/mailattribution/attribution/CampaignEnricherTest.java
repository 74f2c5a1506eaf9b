package com.mailattribution.attribution;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.mailattribution.TestFixtures;
import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.UpstreamApiException;
import com.mailattribution.model.CampaignRevenue;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CampaignEnricherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-27T20:00:00Z"), ZoneOffset.UTC);

    @Mock private SendingPlatformClient sendingPlatformClient;

    private AppProperties appProperties;
    private CampaignEnricher enricher;

    @BeforeEach
    void setUp() {
        appProperties = TestFixtures.appProperties();
        enricher =
                new CampaignEnricher(
                        sendingPlatformClient,
                        TestFixtures.directCalls("sending-platform"),
                        TestFixtures.identifierCodec(),
                        appProperties,
                        CLOCK);
    }

    private static CampaignMetadata metadata(String mailingId, String name) {
        return CampaignMetadata.builder()
                .mailingId(mailingId)
                .name(name)
                .sent(10_000)
                .delivered(8_000)
                .uniqueOpens(400)
                .espName("SparkPost")
                .build();
    }

    private static CampaignRevenue campaign(String mailingId, String propertyCode) {
        return CampaignRevenue.builder()
                .mailingId(mailingId)
                .campaignName(mailingId)
                .propertyCode(propertyCode)
                .revenue(new BigDecimal("200.00"))
                .build();
    }

    @Test
    @DisplayName("Cached campaigns are joined without any lookup and derive eCPM, RPM and revenue per open")
    void enrich_FromCachedCampaigns() {
        // Arrange
        enricher.cacheCampaigns(List.of(metadata("111", "02052025_TDIH_407_FidelityLife_OPENERS")));

        // Act
        CampaignRevenue enriched = enricher.enrich(List.of(campaign("111", "TDIH"))).get(0);

        // Assert
        assertTrue(enriched.isPlatformLinked());
        assertEquals("02052025_TDIH_407_FidelityLife_OPENERS", enriched.getCampaignName());
        assertEquals("SparkPost", enriched.getEspName());
        assertEquals(0, new BigDecimal("25").compareTo(enriched.getEcpm()));
        assertEquals(0, new BigDecimal("20").compareTo(enriched.getRpm()));
        assertEquals(0, new BigDecimal("0.5").compareTo(enriched.getRevenuePerOpen()));
        assertEquals(1, enricher.getPlatformCampaigns().size());
        verifyNoInteractions(sendingPlatformClient);
    }

    @Test
    @DisplayName("Not-found answers are cached; failed lookups are retried on the next call")
    void enrich_CachesNegativeButNotFailures() {
        // Arrange
        when(sendingPlatformClient.getCampaign("222")).thenReturn(Optional.empty());
        when(sendingPlatformClient.getCampaign("333"))
                .thenThrow(new UpstreamApiException("timeout"))
                .thenReturn(Optional.of(metadata("333", "HRO_1944_Offer_ALL")));
        List<CampaignRevenue> campaigns = List.of(campaign("222", "TDIH"), campaign("333", "TDIH"));

        // Act
        List<CampaignRevenue> first = enricher.enrich(campaigns);
        List<CampaignRevenue> second = enricher.enrich(campaigns);

        // Assert
        assertFalse(first.get(0).isPlatformLinked());
        assertFalse(first.get(1).isPlatformLinked());
        assertFalse(second.get(0).isPlatformLinked());
        assertTrue(second.get(1).isPlatformLinked());
        verify(sendingPlatformClient, times(1)).getCampaign("222");
        verify(sendingPlatformClient, times(2)).getCampaign("333");
    }

    @Test
    @DisplayName("An uncatalogued property is replaced by the property in the platform campaign name")
    void enrich_ResolvesPropertyFromName() {
        enricher.cacheCampaigns(List.of(metadata("111", "02052025_HRO_1944_FidelityLife_OPENERS")));

        CampaignRevenue enriched = enricher.enrich(List.of(campaign("111", "ZZZ"))).get(0);

        assertEquals("HRO", enriched.getPropertyCode());
        assertEquals("horoscopeinfo.com", enriched.getPropertyName());
    }

    @Test
    @DisplayName("Property resolution uses the cache first and caps uncached lookups")
    void resolvePropertyCodes_CapsLookups() {
        // Arrange
        appProperties.getEnrichment().setMaxLookups(1);
        enricher.cacheCampaigns(List.of(metadata("111", "02052025_HRO_1944_FidelityLife_OPENERS")));
        when(sendingPlatformClient.getCampaign(anyString()))
                .thenReturn(Optional.of(metadata("222", "TDIH_407_Offer_ALL")));

        // Act
        Map<String, String> resolved = enricher.resolvePropertyCodes(List.of("111", "222", "333"));

        // Assert
        assertEquals(Map.of("111", "HRO", "222", "TDIH"), resolved);
        verify(sendingPlatformClient).getCampaign("222");
        verify(sendingPlatformClient, never()).getCampaign("333");
    }
}
