package com.nasexporter.service.config;

import com.nasexporter.collectors.config.NasApiConfig;
import com.nasexporter.core.model.TargetInstance;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

public record ExporterConfig(
        InetSocketAddress listenAddress,
        String telemetryPath,
        boolean exporterMetricsEnabled,
        int maxRequests,
        TargetInstance target,
        NasApiConfig api,
        Level logLevel,
        TrustStoreConfig trustStore
) {
    public ExporterConfig {
        Objects.requireNonNull(listenAddress, "listenAddress is required");
        Objects.requireNonNull(telemetryPath, "telemetryPath is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(api, "api is required");
        Objects.requireNonNull(logLevel, "logLevel is required");
        if (!telemetryPath.startsWith("/")) {
            throw new IllegalArgumentException("web.telemetry-path must start with '/': " + telemetryPath);
        }
        if (maxRequests < 0) {
            throw new IllegalArgumentException("web.max-requests must not be negative: " + maxRequests);
        }
    }

    public Optional<TrustStoreConfig> trustStoreConfig() {
        return Optional.ofNullable(trustStore);
    }
}
