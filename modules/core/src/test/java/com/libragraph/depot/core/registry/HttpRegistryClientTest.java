package com.libragraph.depot.core.registry;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryBundle;
import com.libragraph.depot.core.registry.model.BinaryPart;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.CreateBinaryPartRequest;
import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.core.registry.model.LegacyBundle;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.types.BinaryState;
import com.libragraph.depot.types.PartState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.patch;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpRegistryClientTest {

    private static final String ORG = "prn:1:7d3c8a52-1f4e-4c1b-9a3e-2b5d6f708192";
    private static final String VERSION_PRN = ORG + ":artifact_version:9a8b7c6d-5e4f-4a3b-9c2d-1e0f11223344";
    private static final String BINARY_PRN = ORG + ":binary:0a1b2c3d-4e5f-4a6b-8c7d-9e0f1a2b3c4d";
    private static final String BUNDLE_PRN = ORG + ":bundle:c0ffee00-1234-4abc-8def-0123456789ab";

    private WireMockServer server;
    private HttpRegistryClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        client = new HttpRegistryClient(settings("secret-key", 2));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private RegistrySettings settings(String apiKey, int retries) {
        return new RegistrySettings(URI.create(server.baseUrl() + "/api"), Optional.ofNullable(apiKey),
                Duration.ofSeconds(5), retries, Duration.ofMillis(1));
    }

    private static String binaryJson(String state) {
        return "{\"prn\":\"" + BINARY_PRN + "\",\"artifact_version_prn\":\"" + VERSION_PRN + "\","
                + "\"target\":\"arm64\",\"size\":3,\"hash\":\"abc\",\"state\":\"" + state + "\","
                + "\"inserted_at\":\"2024-05-01T10:00:00Z\"}";
    }

    @Test
    void shouldSendBearerKeyAndUnwrapEnvelope() {
        server.stubFor(get(urlPathEqualTo("/api/users/me"))
                .withHeader("Authorization", equalTo("Bearer secret-key"))
                .willReturn(okJson("{\"user\":{\"email\":\"ci@example.com\",\"username\":\"ci\",\"organization_prn\":\"" + ORG + "\"}}")));

        assertThat(client.currentUser().organizationPrn()).isEqualTo(ORG);
    }

    @Test
    void shouldReturnEmptyForMissingResource() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN)).willReturn(aResponse().withStatus(404)));

        assertThat(client.getBinary(BINARY_PRN)).isEmpty();
    }

    @Test
    void shouldMapUnknownStateToUnrecognized() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN))
                .willReturn(okJson("{\"binary\":" + binaryJson("quarantined") + "}")));

        Binary binary = client.getBinary(BINARY_PRN).orElseThrow();

        assertThat(binary.state()).isEqualTo(BinaryState.UNRECOGNIZED);
        assertThat(binary.size()).isEqualTo(3L);
        assertThat(binary.signatures()).isEmpty();
    }

    @Test
    void shouldSendStateUpdateInEnvelope() {
        server.stubFor(patch(urlPathEqualTo("/api/binaries/" + BINARY_PRN))
                .withRequestBody(equalToJson("{\"binary\":{\"state\":\"hashing\"}}"))
                .willReturn(okJson("{\"binary\":" + binaryJson("hashing") + "}")));

        Binary binary = client.updateBinary(BINARY_PRN, UpdateBinaryRequest.state(BinaryState.HASHING));

        assertThat(binary.state()).isEqualTo(BinaryState.HASHING);
    }

    @Test
    void shouldFollowSearchPagesByCursor() {
        String search = "artifact_version_prn:'" + VERSION_PRN + "' and target:'arm64'";
        server.stubFor(get(urlPathEqualTo("/api/binaries"))
                .withQueryParam("search", equalTo(search))
                .withQueryParam("page", absent())
                .willReturn(okJson("{\"binaries\":[" + binaryJson("signed") + "],\"next_page\":\"g3QAAAAB\"}")));
        server.stubFor(get(urlPathEqualTo("/api/binaries"))
                .withQueryParam("search", equalTo(search))
                .withQueryParam("page", equalTo("g3QAAAAB"))
                .willReturn(okJson("{\"binaries\":[" + binaryJson("uploadable") + "],\"next_page\":null}")));

        List<Binary> binaries = client.findBinaries(VERSION_PRN, "arm64");

        assertThat(binaries).extracting(Binary::state).containsExactly(BinaryState.SIGNED, BinaryState.UPLOADABLE);
        server.verify(2, getRequestedFor(urlPathEqualTo("/api/binaries")));
    }

    @Test
    void shouldStopSearchWithoutNextPage() {
        server.stubFor(get(urlPathEqualTo("/api/binaries"))
                .willReturn(okJson("{\"binaries\":[" + binaryJson("hashing") + "]}")));

        assertThat(client.findBinaries(VERSION_PRN, null)).hasSize(1);
        server.verify(1, getRequestedFor(urlPathEqualTo("/api/binaries")));
    }

    @Test
    void shouldDecodePartsAndTheirStates() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN + "/parts"))
                .willReturn(okJson("{\"binary_parts\":[{\"binary_prn\":\"" + BINARY_PRN + "\",\"index\":1,"
                        + "\"size\":5242880,\"hash\":\"aa\",\"state\":\"valid\"}]}")));
        server.stubFor(post(urlPathEqualTo("/api/binaries/" + BINARY_PRN + "/parts"))
                .withRequestBody(equalToJson("{\"binary_part\":{\"index\":2,\"size\":10,\"hash\":\"bb\",\"expected_binary_size\":5242890}}"))
                .willReturn(okJson("{\"binary_part\":{\"binary_prn\":\"" + BINARY_PRN + "\",\"index\":2,\"size\":10,"
                        + "\"hash\":\"bb\",\"presigned_upload_url\":\"https://s3.test/part2\",\"state\":\"pending\"}}")));

        assertThat(client.listBinaryParts(BINARY_PRN)).singleElement().extracting(BinaryPart::isValid).isEqualTo(true);
        BinaryPart created = client.createBinaryPart(BINARY_PRN, new CreateBinaryPartRequest(2, 10, "bb", 5242890));
        assertThat(created.state()).isEqualTo(PartState.PENDING);
        assertThat(created.presignedUploadUrl()).isEqualTo("https://s3.test/part2");
    }

    @Test
    void shouldRetryRateLimitedRequest() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN)).inScenario("rate")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(429))
                .willSetStateTo("open"));
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN)).inScenario("rate")
                .whenScenarioStateIs("open")
                .willReturn(okJson("{\"binary\":" + binaryJson("signable") + "}")));

        assertThat(client.getBinary(BINARY_PRN)).get().extracting(Binary::state).isEqualTo(BinaryState.SIGNABLE);
        server.verify(2, getRequestedFor(urlPathEqualTo("/api/binaries/" + BINARY_PRN)));
    }

    @Test
    void shouldGiveUpAfterConfiguredRetries() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN))
                .willReturn(aResponse().withStatus(429).withBody("{\"errors\":{\"detail\":\"too_many_requests\"}}")));

        assertThatThrownBy(() -> client.getBinary(BINARY_PRN))
                .isInstanceOfSatisfying(RegistryException.class, e -> {
                    assertThat(e.isRateLimited()).isTrue();
                    assertThat(e.responseBody()).contains("too_many_requests");
                });
        server.verify(3, getRequestedFor(urlPathEqualTo("/api/binaries/" + BINARY_PRN)));
    }

    @Test
    void shouldCarryStatusAndBodyOfFailedRequest() {
        server.stubFor(patch(urlPathEqualTo("/api/binaries/" + BINARY_PRN))
                .willReturn(aResponse().withStatus(422).withBody("{\"errors\":{\"state\":[\"invalid transition\"]}}")));

        assertThatThrownBy(() -> client.updateBinary(BINARY_PRN, UpdateBinaryRequest.state(BinaryState.SIGNED)))
                .isInstanceOfSatisfying(RegistryException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(422);
                    assertThat(e.responseBody()).contains("invalid transition");
                });
    }

    @Test
    void shouldRequireApiKeyBeforeSending() {
        HttpRegistryClient anonymous = new HttpRegistryClient(settings(null, 0));

        assertThatThrownBy(anonymous::currentUser).isInstanceOf(ValidationException.class);
        assertThat(server.getAllServeEvents()).isEmpty();
    }

    @Test
    void shouldReadBothBundleSchemas() {
        server.stubFor(get(urlPathEqualTo("/api/bundles/" + BUNDLE_PRN))
                .willReturn(okJson("{\"bundle\":{\"prn\":\"" + BUNDLE_PRN + "\",\"name\":\"r1\","
                        + "\"binaries\":[{\"prn\":\"" + BINARY_PRN + "\",\"custom_metadata\":{\"slot\":\"a\"}}]}}")));
        server.stubFor(post(urlPathEqualTo("/api/bundles"))
                .withRequestBody(equalToJson("{\"bundle\":{\"name\":\"r0\",\"artifact_versions\":[\"" + VERSION_PRN + "\"]}}"))
                .willReturn(okJson("{\"bundle\":{\"prn\":\"" + BUNDLE_PRN + "\",\"name\":\"r0\","
                        + "\"artifact_versions\":[\"" + VERSION_PRN + "\"]}}")));

        Bundle current = client.getBundle(BUNDLE_PRN).orElseThrow();
        Bundle legacy = client.createBundle(CreateBundleRequest.forApiVersion(1, null, "r0", List.of(), List.of(VERSION_PRN)));

        assertThat(current).isInstanceOfSatisfying(BinaryBundle.class, b ->
                assertThat(b.binaries().get(0).customMetadata()).containsEntry("slot", "a"));
        assertThat(legacy).isInstanceOfSatisfying(LegacyBundle.class, b ->
                assertThat(b.artifactVersionPrns()).containsExactly(VERSION_PRN));
    }

    @Test
    void shouldReturnDownloadUrlWhenIssued() {
        server.stubFor(get(urlPathEqualTo("/api/binaries/" + BINARY_PRN + "/download"))
                .willReturn(okJson("{\"binary_download\":{\"url\":\"https://s3.test/object?sig=1\"}}")));

        assertThat(client.binaryDownloadUrl(BINARY_PRN)).contains(URI.create("https://s3.test/object?sig=1"));
    }
}
