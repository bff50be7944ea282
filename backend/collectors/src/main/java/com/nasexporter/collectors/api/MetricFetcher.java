package com.nasexporter.collectors.api;

import com.nasexporter.core.model.TargetInstance;

/**
 * Fetches the most recent value of a single statistic for the target instance. Implementations
 * block until the vendor API answers and never retry; the next scrape is the retry.
 */
public interface MetricFetcher {
    double fetch(String metricName, TargetInstance target) throws MetricFetchException;
}
