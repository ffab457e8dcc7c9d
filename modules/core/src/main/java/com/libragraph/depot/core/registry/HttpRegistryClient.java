package com.libragraph.depot.core.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryPart;
import com.libragraph.depot.core.registry.model.BinarySignature;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.CreateArtifactRequest;
import com.libragraph.depot.core.registry.model.CreateArtifactVersionRequest;
import com.libragraph.depot.core.registry.model.CreateBinaryPartRequest;
import com.libragraph.depot.core.registry.model.CreateBinaryRequest;
import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.core.registry.model.CreateSignatureRequest;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.core.registry.model.User;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link RegistryClient} over the registry's JSON REST API.
 *
 * <p>Request and response bodies wrap the resource in a single-key envelope named after it,
 * e.g. {@code {"binary": {...}}}. Rate-limited calls (HTTP 429) are retried with exponential
 * backoff; every other non-2xx status fails immediately.
 */
public class HttpRegistryClient implements RegistryClient {

    private static final Logger log = Logger.getLogger(HttpRegistryClient.class);

    private final RegistrySettings settings;
    private final HttpClient http;
    private final ObjectMapper mapper;

    public HttpRegistryClient(RegistrySettings settings) {
        this(settings, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpRegistryClient(RegistrySettings settings, HttpClient http) {
        this.settings = settings;
        this.http = http;
        this.mapper = RegistryJson.newMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public User currentUser() {
        return get("/users/me", "user", User.class)
                .orElseThrow(() -> new ResourceNotFoundException("User", "me"));
    }

    @Override
    public Optional<Artifact> getArtifact(String prn) {
        return get("/artifacts/" + prn, "artifact", Artifact.class);
    }

    @Override
    public Artifact createArtifact(CreateArtifactRequest request) {
        return send("POST", "/artifacts", "artifact", request, Artifact.class);
    }

    @Override
    public Optional<ArtifactVersion> getArtifactVersion(String prn) {
        return get("/artifact_versions/" + prn, "artifact_version", ArtifactVersion.class);
    }

    @Override
    public ArtifactVersion createArtifactVersion(CreateArtifactVersionRequest request) {
        return send("POST", "/artifact_versions", "artifact_version", request, ArtifactVersion.class);
    }

    @Override
    public Optional<Binary> getBinary(String prn) {
        return get("/binaries/" + prn, "binary", Binary.class);
    }

    @Override
    public List<Binary> findBinaries(String artifactVersionPrn, String target) {
        String search = "artifact_version_prn:'" + artifactVersionPrn + "'";
        if (target != null) {
            search += " and target:'" + target + "'";
        }
        List<Binary> result = new ArrayList<>();
        // next_page is an opaque cursor, handed back as received
        String page = null;
        do {
            String path = "/binaries?search=" + encode(search) + (page == null ? "" : "&page=" + encode(page));
            JsonNode root = exchange("GET", path, null)
                    .orElseThrow(() -> new RegistryException("Binary search returned nothing for " + artifactVersionPrn, 404, null));
            result.addAll(readList(root.get("binaries"), Binary.class));
            JsonNode next = root.get("next_page");
            page = next == null || next.isNull() || next.asText().isEmpty() ? null : next.asText();
        } while (page != null);
        log.debugf("Found %d binaries for %s (target %s)", result.size(), artifactVersionPrn, target);
        return result;
    }

    @Override
    public Binary createBinary(CreateBinaryRequest request) {
        return send("POST", "/binaries", "binary", request, Binary.class);
    }

    @Override
    public Binary updateBinary(String prn, UpdateBinaryRequest request) {
        return send("PATCH", "/binaries/" + prn, "binary", request, Binary.class);
    }

    @Override
    public List<BinaryPart> listBinaryParts(String binaryPrn) {
        JsonNode root = exchange("GET", "/binaries/" + binaryPrn + "/parts", null)
                .orElseThrow(() -> new ResourceNotFoundException("Binary", binaryPrn));
        return readList(root.get("binary_parts"), BinaryPart.class);
    }

    @Override
    public BinaryPart createBinaryPart(String binaryPrn, CreateBinaryPartRequest request) {
        return send("POST", "/binaries/" + binaryPrn + "/parts", "binary_part", request, BinaryPart.class);
    }

    @Override
    public BinarySignature createBinarySignature(CreateSignatureRequest request) {
        return send("POST", "/binary_signatures", "binary_signature", request, BinarySignature.class);
    }

    @Override
    public Optional<URI> binaryDownloadUrl(String binaryPrn) {
        return exchange("GET", "/binaries/" + binaryPrn + "/download", null)
                .map(root -> root.path("binary_download").path("url"))
                .filter(url -> url.isTextual() && !url.asText().isBlank())
                .map(url -> URI.create(url.asText()));
    }

    @Override
    public Optional<Bundle> getBundle(String prn) {
        return get("/bundles/" + prn, "bundle", BundleWire.class).map(BundleWire::toBundle);
    }

    @Override
    public Bundle createBundle(CreateBundleRequest request) {
        return send("POST", "/bundles", "bundle", request, BundleWire.class).toBundle();
    }

    private <T> Optional<T> get(String path, String envelope, Class<T> type) {
        return exchange("GET", path, null).map(root -> unwrap(root, envelope, type));
    }

    private <T> T send(String method, String path, String envelope, Object body, Class<T> type) {
        JsonNode root = exchange(method, path, Map.of(envelope, body))
                .orElseThrow(() -> new RegistryException(method + " " + path + " returned no resource", 404, null));
        return unwrap(root, envelope, type);
    }

    private <T> T unwrap(JsonNode root, String envelope, Class<T> type) {
        JsonNode node = root.get(envelope);
        if (node == null || node.isNull()) {
            throw new RegistryException("Response is missing '" + envelope + "'", 0, root.toString());
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new RegistryException("Unreadable '" + envelope + "' in registry response", e);
        }
    }

    private <T> List<T> readList(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        CollectionType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            return mapper.convertValue(node, listType);
        } catch (IllegalArgumentException e) {
            throw new RegistryException("Unreadable list of " + type.getSimpleName() + " in registry response", e);
        }
    }

    /**
     * Performs one call. A GET answered with 404 yields an empty result.
     */
    private Optional<JsonNode> exchange(String method, String path, Object body) {
        String apiKey = settings.apiKey()
                .orElseThrow(() -> new ValidationException("No registry API key configured"));
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new RegistryException("Failed to encode " + method + " " + path, e);
        }
        HttpRequest request = HttpRequest.newBuilder(resolve(path))
                .timeout(settings.requestTimeout())
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> response = sendWithRetry(request);
        int status = response.statusCode();
        if (status == 404 && "GET".equals(method)) {
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new RegistryException(method + " " + path + " failed", status, response.body());
        }
        String text = response.body();
        if (text == null || text.isBlank()) {
            return Optional.of(mapper.createObjectNode());
        }
        try {
            return Optional.of(mapper.readTree(text));
        } catch (JsonProcessingException e) {
            throw new RegistryException("Registry returned invalid JSON for " + method + " " + path, e);
        }
    }

    private HttpResponse<String> sendWithRetry(HttpRequest request) {
        Duration backoff = settings.rateLimitBackoff();
        for (int attempt = 0; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new RegistryException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryException("Interrupted during " + request.method() + " " + request.uri(), e);
            }
            if (response.statusCode() != 429 || attempt >= settings.rateLimitRetries()) {
                return response;
            }
            log.warnf("Rate limited on %s %s, retrying in %d ms (attempt %d of %d)",
                    request.method(), request.uri().getPath(), backoff.toMillis(), attempt + 1, settings.rateLimitRetries());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryException("Interrupted while backing off from rate limit", e);
            }
            backoff = backoff.multipliedBy(2);
        }
    }

    private URI resolve(String path) {
        String base = settings.baseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
