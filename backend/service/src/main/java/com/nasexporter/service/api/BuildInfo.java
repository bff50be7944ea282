package com.nasexporter.service.api;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;

public final class BuildInfo {
    public static final String EXPORTER_NAME = "nifcloud_nas_exporter";

    private BuildInfo() {
    }

    public static String version() {
        String version = BuildInfo.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }

    public static String describe() {
        return EXPORTER_NAME + ", version " + version() + " (java " + System.getProperty("java.version") + ")";
    }

    /**
     * Registers the constant {@code nifcloud_nas_exporter_build_info} gauge.
     */
    public static Gauge register(CollectorRegistry registry) {
        Gauge gauge = Gauge.build()
                .name(EXPORTER_NAME + "_build_info")
                .help("A metric with a constant '1' value labeled by version and java version from which "
                        + EXPORTER_NAME + " was built.")
                .labelNames("version", "java_version")
                .register(registry);
        gauge.labels(version(), System.getProperty("java.version")).set(1);
        return gauge;
    }
}
