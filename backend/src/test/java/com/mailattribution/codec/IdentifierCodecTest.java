package com.mailattribution.codec;

import static org.junit.jupiter.api.Assertions.*;

import com.mailattribution.TestFixtures;
import com.mailattribution.exception.IdentifierParseException;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdentifierCodecTest {

    private final IdentifierCodec codec = TestFixtures.identifierCodec();

    @Test
    @DisplayName("parseSub1 extracts property, offer and mailing id from a full tag")
    void parseSub1_FullTag() {
        ParsedSub1 parsed = codec.parseSub1("TDIH_407_3926_01262026_3219537162");

        assertEquals("TDIH", parsed.getPropertyCode());
        assertEquals("thisdayinhistory.co", parsed.getPropertyName());
        assertEquals("407", parsed.getOfferId());
        assertEquals("01262026", parsed.getDate());
        assertEquals("3219537162", parsed.getMailingId());
    }

    @Test
    @DisplayName("parseSub1 upper-cases a lower-case property code")
    void parseSub1_LowerCaseProperty() {
        ParsedSub1 parsed = codec.parseSub1("hro_1944_02052025_3300000001");

        assertEquals("HRO", parsed.getPropertyCode());
        assertEquals("horoscopeinfo.com", parsed.getPropertyName());
        assertEquals("3300000001", parsed.getMailingId());
    }

    @Test
    @DisplayName("parseSub1 falls back to a long numeric last segment as mailing id")
    void parseSub1_FallbackMailingId() {
        ParsedSub1 parsed = codec.parseSub1("FTT_1200_12345678");

        assertEquals("FTT", parsed.getPropertyCode());
        assertEquals("1200", parsed.getOfferId());
        // 12345678 is also a date-shaped token with nothing after it
        assertEquals("12345678", parsed.getMailingId());
    }

    @Test
    @DisplayName("parseSub1 rejects blank and single-segment tags")
    void parseSub1_Invalid() {
        assertThrows(IdentifierParseException.class, () -> codec.parseSub1(""));
        assertThrows(IdentifierParseException.class, () -> codec.parseSub1("   "));
        assertThrows(IdentifierParseException.class, () -> codec.parseSub1("TDIH"));
    }

    @Test
    @DisplayName("classifySub1 buckets tags by why they cannot be attributed")
    void classifySub1_Reasons() {
        assertEquals(Sub1Reason.EMPTY_TAG, codec.classifySub1("").getReason());
        assertEquals(Sub1Reason.EMPTY_TAG, codec.classifySub1(null).getReason());
        assertEquals(Sub1Reason.PARSE_ERROR, codec.classifySub1("garbage").getReason());
        assertEquals(Sub1Reason.NO_MAILING_ID, codec.classifySub1("TDIH_407").getReason());
        assertEquals(
                Sub1Reason.UNKNOWN_PROPERTY,
                codec.classifySub1("ZZZ_407_01262026_3219537162").getReason());
        assertEquals(
                Sub1Reason.KNOWN_PROPERTY,
                codec.classifySub1("TDIH_407_3926_01262026_3219537162").getReason());
    }

    @Test
    @DisplayName("parseSub2 treats ten lower-case hex characters as an email hash")
    void parseSub2_EmailHash() {
        Optional<ParsedSub2> parsed = codec.parseSub2("a1b2c3d4e5");

        assertTrue(parsed.isPresent());
        assertTrue(parsed.get().isEmailHash());
        assertFalse(parsed.get().isAttributable());
        assertNull(parsed.get().getPartnerName());
    }

    @Test
    @DisplayName("parseSub2 trims the trailing underscore and resolves the partner by prefix")
    void parseSub2_PartnerPrefix() {
        ParsedSub2 parsed = codec.parseSub2("M77_WIT_").orElseThrow();

        assertEquals("M77_WIT", parsed.getDataSetCode());
        assertEquals("M77", parsed.getPartnerPrefix());
        assertEquals("Media717", parsed.getPartnerName());
        assertTrue(parsed.isAttributable());
    }

    @Test
    @DisplayName("parseSub2 applies data-set overrides before the prefix rule")
    void parseSub2_Override() {
        ParsedSub2 parsed = codec.parseSub2("GLB_BR").orElseThrow();

        assertEquals("IGN", parsed.getPartnerPrefix());
        assertEquals("Ignite", parsed.getPartnerName());
    }

    @Test
    @DisplayName("parseSub2 ignores blanks, placeholders and template variables")
    void parseSub2_Ignored() {
        assertTrue(codec.parseSub2(null).isEmpty());
        assertTrue(codec.parseSub2("  ").isEmpty());
        assertTrue(codec.parseSub2("N/A").isEmpty());
        assertTrue(codec.parseSub2("{{sub2}}").isEmpty());
    }

    @Test
    @DisplayName("parseCampaignName reads date, property, offer, name and segment")
    void parseCampaignName_Full() {
        ParsedCampaignName parsed = codec.parseCampaignName("02052025_HRO_1944_FidelityLife_OPENERS");

        assertEquals("02052025", parsed.getDate());
        assertEquals("HRO", parsed.getProperty());
        assertEquals("1944", parsed.getOfferId());
        assertEquals("FidelityLife", parsed.getOfferName());
        assertEquals("OPENERS", parsed.getSegment());
    }

    @Test
    @DisplayName("propertyFromCampaignName only returns catalogued properties")
    void propertyFromCampaignName() {
        assertEquals(Optional.of("HRO"), codec.propertyFromCampaignName("02052025_HRO_1944_Fidelity_OPENERS"));
        assertTrue(codec.propertyFromCampaignName("02052025_ZZZ_1944_Fidelity_OPENERS").isEmpty());
        assertTrue(codec.propertyFromCampaignName("short").isEmpty());
    }
}
