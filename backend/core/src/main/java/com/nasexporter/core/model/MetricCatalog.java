package com.nasexporter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The fixed set of NAS statistics republished by the exporter, plus the naming rules for the
 * exposition side. Built once at startup and shared read-only.
 */
public final class MetricCatalog {
    public static final String NAS_NAMESPACE = "nifcloud_nas";

    private final String namespace;
    private final List<MetricDefinition> metrics;

    public MetricCatalog(String namespace, List<MetricDefinition> metrics) {
        this.namespace = Objects.requireNonNull(namespace, "namespace is required");
        this.metrics = List.copyOf(metrics);
        if (this.metrics.isEmpty()) {
            throw new IllegalArgumentException("catalog must contain at least one metric");
        }
        long distinct = this.metrics.stream().map(MetricDefinition::name).distinct().count();
        if (distinct != this.metrics.size()) {
            throw new IllegalArgumentException("metric names must be unique");
        }
    }

    public static MetricCatalog nas() {
        return new MetricCatalog(NAS_NAMESPACE, List.of(
                metric("FreeStorageSpace", "free_storage_space",
                        "The amount of available storage space. Units: Bytes"),
                metric("UsedStorageSpace", "used_storage_space",
                        "The amount of used storage space. Units: Bytes"),
                metric("ReadIOPS", "read_iops",
                        "The average number of disk read I/O operations per second. Units: Count/Second"),
                metric("WriteIOPS", "write_iops",
                        "The average number of disk write I/O operations per second. Units: Count/Second"),
                metric("ReadThroughput", "read_throughput",
                        "The average number of bytes read from disk per second. Units: Bytes/Second"),
                metric("WriteThroughput", "write_throughput",
                        "The average number of bytes written to disk per second. Units: Bytes/Second"),
                metric("ActiveConnections", "active_connections",
                        "The active connection counts. Units: Count"),
                metric("GlobalReadTraffic", "global_read_traffic",
                        "The incoming (Receive) network traffic from global on the NAS instance. Units: Bytes/second"),
                metric("PrivateReadTraffic", "private_read_traffic",
                        "The incoming (Receive) network traffic from private on the NAS instance. Units: Bytes/second"),
                metric("GlobalWriteTraffic", "global_write_traffic",
                        "The outgoing (Transmit) network traffic to global on the NAS instance. Units: Bytes/second"),
                metric("PrivateWriteTraffic", "private_write_traffic",
                        "The outgoing (Transmit) network traffic to private on the NAS instance. Units: Bytes/second")
        ));
    }

    public List<MetricDefinition> metrics() {
        return metrics;
    }

    public int size() {
        return metrics.size();
    }

    public String scrapeDurationName() {
        return namespace + "_scrape_collector_duration_seconds";
    }

    public String scrapeSuccessName() {
        return namespace + "_scrape_collector_success";
    }

    private static MetricDefinition metric(String name, String suffix, String help) {
        return new MetricDefinition(name, NAS_NAMESPACE + "_" + suffix, help);
    }
}
