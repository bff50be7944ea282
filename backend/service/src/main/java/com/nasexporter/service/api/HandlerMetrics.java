package com.nasexporter.service.api;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Instrumentation of the telemetry endpoint itself.
 */
public final class HandlerMetrics {
    private final Counter requests;
    private final Gauge inFlight;

    private HandlerMetrics(Counter requests, Gauge inFlight) {
        this.requests = requests;
        this.inFlight = inFlight;
    }

    public static HandlerMetrics register(CollectorRegistry registry) {
        Counter requests = Counter.build()
                .name(BuildInfo.EXPORTER_NAME + "_http_requests_total")
                .help("Total number of scrapes by HTTP status code.")
                .labelNames("code")
                .register(registry);
        Gauge inFlight = Gauge.build()
                .name(BuildInfo.EXPORTER_NAME + "_http_requests_in_flight")
                .help("Current number of scrapes being served.")
                .register(registry);
        return new HandlerMetrics(requests, inFlight);
    }

    void started() {
        inFlight.inc();
    }

    void finished(int status) {
        inFlight.dec();
        requests.labels(Integer.toString(status)).inc();
    }
}
