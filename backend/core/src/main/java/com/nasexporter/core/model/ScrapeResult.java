package com.nasexporter.core.model;

import java.time.Duration;

/**
 * Outcome of fetching one metric during a single collection pass. {@code value} is only
 * meaningful when {@code success} is true.
 */
public record ScrapeResult(MetricDefinition metric, double value, Duration duration, boolean success) {
    public static ScrapeResult success(MetricDefinition metric, double value, Duration duration) {
        return new ScrapeResult(metric, value, duration, true);
    }

    public static ScrapeResult failure(MetricDefinition metric, Duration duration) {
        return new ScrapeResult(metric, Double.NaN, duration, false);
    }

    public double durationSeconds() {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
