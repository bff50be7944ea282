package com.nasexporter.collectors.config;

import com.nasexporter.core.model.Credentials;
import com.nasexporter.core.model.TargetInstance;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the NIFCLOUD NAS statistics API. {@code endpoint} may be null, in which
 * case the regional endpoint of the target instance is used.
 */
public record NasApiConfig(
        Credentials credentials,
        URI endpoint,
        String apiVersion,
        Duration window,
        Duration requestTimeout
) {
    public static final String DEFAULT_API_VERSION = "N2016-02-24";
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(180);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    public NasApiConfig {
        Objects.requireNonNull(credentials, "credentials are required");
        Objects.requireNonNull(apiVersion, "apiVersion is required");
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static NasApiConfig withDefaults(Credentials credentials) {
        return new NasApiConfig(credentials, null, DEFAULT_API_VERSION, DEFAULT_WINDOW, DEFAULT_REQUEST_TIMEOUT);
    }

    public URI endpointFor(TargetInstance target) {
        if (endpoint != null) {
            return endpoint;
        }
        return URI.create("https://nas." + target.region() + ".api.nifcloud.com/");
    }
}
