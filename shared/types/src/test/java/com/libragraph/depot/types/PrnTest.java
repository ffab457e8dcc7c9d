package com.libragraph.depot.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PrnTest {

    private static final String ORG = "550e8400-e29b-41d4-a716-446655440000";
    private static final String RESOURCE = "550e8400-e29b-41d4-a716-446655440001";

    @Test
    void shouldParseResourcePrn() {
        Prn prn = Prn.parse("prn:1:" + ORG + ":binary:" + RESOURCE);

        assertThat(prn.organizationId()).isEqualTo(ORG);
        assertThat(prn.resourceType()).isEqualTo("binary");
        assertThat(prn.resourceId()).isEqualTo(RESOURCE);
        assertThat(prn.isType(ResourceType.BINARY)).isTrue();
        assertThat(prn.organizationPrn()).isEqualTo("prn:1:" + ORG);
    }

    @Test
    void shouldRoundTripToString() {
        String text = "prn:1:" + ORG + ":artifact_version:" + RESOURCE;
        assertThat(Prn.parse(text).toString()).isEqualTo(text);
    }

    @Test
    void shouldRejectWrongPartCount() {
        assertThatThrownBy(() -> Prn.parse("invalid:prn"))
                .isInstanceOf(PrnException.class)
                .hasMessageContaining("got 2 parts")
                .extracting(e -> ((PrnException) e).kind())
                .isEqualTo(PrnException.Kind.INVALID_FORMAT);
    }

    @Test
    void shouldRejectInvalidPrefix() {
        assertThatThrownBy(() -> Prn.parse("urn:1:" + ORG + ":binary:" + RESOURCE))
                .isInstanceOf(PrnException.class)
                .hasMessage("Invalid PRN prefix: urn");
    }

    @Test
    void shouldRejectUnsupportedVersion() {
        assertThatThrownBy(() -> Prn.parse("prn:2:" + ORG + ":binary:" + RESOURCE))
                .isInstanceOf(PrnException.class)
                .extracting(e -> ((PrnException) e).kind())
                .isEqualTo(PrnException.Kind.UNSUPPORTED_VERSION);
    }

    @Test
    void shouldRejectNonUuidIds() {
        assertThatThrownBy(() -> Prn.parse("prn:1:not-a-uuid:binary:" + RESOURCE))
                .extracting(e -> ((PrnException) e).kind())
                .isEqualTo(PrnException.Kind.INVALID_ORGANIZATION_ID);
        assertThatThrownBy(() -> Prn.parse("prn:1:" + ORG + ":binary:1-1-1-1-1"))
                .extracting(e -> ((PrnException) e).kind())
                .isEqualTo(PrnException.Kind.INVALID_RESOURCE_ID);
    }

    @Test
    void shouldParseOrganizationPrn() {
        assertThat(Prn.parseOrganizationId("prn:1:" + ORG)).isEqualTo(ORG);
        assertThatThrownBy(() -> Prn.parseOrganizationId("prn:1:" + ORG + ":binary:" + RESOURCE))
                .hasMessageContaining("Organization PRN must have 3 parts");
    }
}
