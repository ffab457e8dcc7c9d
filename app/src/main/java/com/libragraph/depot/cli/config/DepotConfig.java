package com.libragraph.depot.cli.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Settings under {@code depot.*}. Values are copied into the core settings records by
 * {@link com.libragraph.depot.cli.PipelineFactory}.
 */
@ConfigMapping(prefix = "depot")
public interface DepotConfig {

    Registry registry();

    Upload upload();

    Hashing hashing();

    /**
     * Named signing keys, selected on the command line with {@code --signing-key-pair}.
     */
    Map<String, KeyPair> signingKeyPairs();

    interface Registry {

        String baseUrl();

        Optional<String> apiKey();

        @WithDefault("30s")
        Duration requestTimeout();

        @WithDefault("3")
        int rateLimitRetries();

        @WithDefault("1s")
        Duration rateLimitBackoff();
    }

    interface Upload {

        @WithDefault("5242880")
        long partSize();

        /** Parts in flight at once; defaults to twice the core count, at most 16. */
        OptionalInt concurrency();
    }

    interface Hashing {

        @WithDefault("10s")
        Duration pollInterval();

        @WithDefault("30")
        int maxAttempts();
    }

    interface KeyPair {

        String signingKeyPrn();

        String privateKeyPath();
    }
}
