package com.libragraph.depot.core.transfer;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.libragraph.depot.core.IntegrityException;
import com.libragraph.depot.core.registry.RegistryException;
import com.libragraph.depot.util.ContentHash;
import com.libragraph.depot.util.buffer.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpObjectTransferTest {

    private static final byte[] PART = "part body".getBytes(StandardCharsets.UTF_8);

    private WireMockServer server;
    private HttpObjectTransfer transfer;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        transfer = new HttpObjectTransfer(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private URI url(String path) {
        return URI.create(server.baseUrl() + path);
    }

    @Test
    void shouldPutBodyWithChecksumHeader() {
        server.stubFor(put(urlPathEqualTo("/bucket/part-1")).willReturn(aResponse().withStatus(200)));

        transfer.put(url("/bucket/part-1?X-Amz-Signature=abc"), PART, ContentHash.of(PART));

        server.verify(putRequestedFor(urlPathEqualTo("/bucket/part-1"))
                .withHeader("x-amz-checksum-sha256", equalTo(ContentHash.of(PART).toBase64()))
                .withHeader("Content-Type", equalTo("application/octet-stream"))
                .withHeader("Content-Length", equalTo(String.valueOf(PART.length)))
                .withRequestBody(binaryEqualTo(PART)));
    }

    @Test
    void shouldFailOnNonSuccessStatus() {
        server.stubFor(put(urlPathEqualTo("/bucket/part-1"))
                .willReturn(aResponse().withStatus(403).withBody("<Error><Code>AccessDenied</Code></Error>")));

        assertThatThrownBy(() -> transfer.put(url("/bucket/part-1"), PART, ContentHash.of(PART)))
                .isInstanceOfSatisfying(RegistryException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(403);
                    assertThat(e.responseBody()).contains("AccessDenied");
                });
    }

    @Test
    void shouldDownloadExactContent() throws Exception {
        server.stubFor(get(urlPathEqualTo("/bucket/object")).willReturn(aResponse().withStatus(200).withBody(PART)));

        try (Buffer buffer = transfer.download(url("/bucket/object"), PART.length)) {
            assertThat(buffer.position()).isZero();
            assertThat(buffer.hash()).isEqualTo(ContentHash.of(PART));
        }
    }

    @Test
    void shouldRejectShortDownload() {
        server.stubFor(get(urlPathEqualTo("/bucket/object")).willReturn(aResponse().withStatus(200).withBody(PART)));

        assertThatThrownBy(() -> transfer.download(url("/bucket/object"), PART.length + 5))
                .isInstanceOf(IntegrityException.class);
    }

    @Test
    void shouldRejectLongDownload() {
        server.stubFor(get(urlPathEqualTo("/bucket/object")).willReturn(aResponse().withStatus(200).withBody(PART)));

        assertThatThrownBy(() -> transfer.download(url("/bucket/object"), PART.length - 1))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("longer");
    }

    @Test
    void shouldFailDownloadOnMissingObject() {
        server.stubFor(get(urlPathEqualTo("/bucket/object")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> transfer.download(url("/bucket/object"), PART.length))
                .isInstanceOfSatisfying(RegistryException.class, e -> assertThat(e.statusCode()).isEqualTo(404));
    }
}
