package com.libragraph.depot.core.registry;

import com.libragraph.depot.core.ValidationException;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for {@link HttpRegistryClient}.
 *
 * @param rateLimitRetries how often a 429 response is retried
 * @param rateLimitBackoff delay before the first retry; doubled for every further one
 */
public record RegistrySettings(URI baseUrl, Optional<String> apiKey, Duration requestTimeout,
                               int rateLimitRetries, Duration rateLimitBackoff) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RATE_LIMIT_RETRIES = 3;
    public static final Duration DEFAULT_RATE_LIMIT_BACKOFF = Duration.ofSeconds(1);

    public RegistrySettings {
        if (baseUrl == null) {
            throw new ValidationException("Registry base URL is required");
        }
        if (rateLimitRetries < 0) {
            throw new ValidationException("Rate limit retries must not be negative, got: " + rateLimitRetries);
        }
        apiKey = apiKey == null ? Optional.empty() : apiKey.filter(k -> !k.isBlank());
    }

    public static RegistrySettings of(URI baseUrl, String apiKey) {
        return new RegistrySettings(baseUrl, Optional.ofNullable(apiKey), DEFAULT_TIMEOUT,
                DEFAULT_RATE_LIMIT_RETRIES, DEFAULT_RATE_LIMIT_BACKOFF);
    }
}
