package com.nasexporter.collectors.nas;

import com.nasexporter.collectors.api.MetricFetcher;
import com.nasexporter.core.model.MetricCatalog;
import com.nasexporter.core.model.MetricDefinition;
import com.nasexporter.core.model.ScrapeResult;
import com.nasexporter.core.model.TargetInstance;
import io.prometheus.client.Collector;
import io.prometheus.client.GaugeMetricFamily;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prometheus collector for one NAS instance. Every {@link #collect()} fetches all catalog metrics
 * in parallel, one task per metric, and returns only after each task has finished. Overlapping
 * passes never queue behind each other: the pool grows with demand and idle threads expire.
 */
public class NasCollector extends Collector implements Collector.Describable, AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(NasCollector.class.getName());

    static final List<String> TARGET_LABELS = List.of("instance", "region");
    static final List<String> META_LABELS = List.of("metric_name");

    private final MetricFetcher fetcher;
    private final MetricCatalog catalog;
    private final TargetInstance target;
    private final ExecutorService executor;

    public NasCollector(MetricFetcher fetcher, MetricCatalog catalog, TargetInstance target) {
        this.fetcher = fetcher;
        this.catalog = catalog;
        this.target = target;
        this.executor = Executors.newCachedThreadPool(fetchThreadFactory());
    }

    @Override
    public List<MetricFamilySamples> describe() {
        List<MetricFamilySamples> families = new ArrayList<>(catalog.size() + 2);
        for (MetricDefinition metric : catalog.metrics()) {
            families.add(new GaugeMetricFamily(metric.exposedName(), metric.help(), TARGET_LABELS));
        }
        families.add(durationFamily());
        families.add(successFamily());
        return families;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<ScrapeResult> results = scrape();

        List<MetricFamilySamples> families = new ArrayList<>();
        GaugeMetricFamily duration = durationFamily();
        GaugeMetricFamily success = successFamily();
        List<String> targetLabels = List.of(target.identifier(), target.region());
        for (ScrapeResult result : results) {
            MetricDefinition metric = result.metric();
            if (result.success()) {
                GaugeMetricFamily value = new GaugeMetricFamily(metric.exposedName(), metric.help(), TARGET_LABELS);
                value.addMetric(targetLabels, result.value());
                families.add(value);
            }
            duration.addMetric(List.of(metric.name()), result.durationSeconds());
            success.addMetric(List.of(metric.name()), result.success() ? 1.0 : 0.0);
        }
        families.add(duration);
        families.add(success);
        return families;
    }

    /**
     * Runs one collection pass. The returned list holds exactly one result per catalog metric, in
     * completion order.
     */
    public List<ScrapeResult> scrape() {
        Queue<ScrapeResult> sink = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> tasks = catalog.metrics().stream()
                .map(metric -> CompletableFuture.runAsync(() -> sink.add(scrapeMetric(metric)), executor))
                .toList();

        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
        return List.copyOf(sink);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ScrapeResult scrapeMetric(MetricDefinition metric) {
        long begin = System.nanoTime();
        try {
            double value = fetcher.fetch(metric.name(), target);
            return ScrapeResult.success(metric, value, Duration.ofNanos(System.nanoTime() - begin));
        } catch (Throwable e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);
            LOGGER.log(Level.SEVERE, String.format(
                    "scrape \"%s\" failed after %.3fs: %s",
                    metric.name(),
                    elapsed.toNanos() / 1_000_000_000.0,
                    e.getMessage()
            ), e);
            return ScrapeResult.failure(metric, elapsed);
        }
    }

    private GaugeMetricFamily durationFamily() {
        return new GaugeMetricFamily(
                catalog.scrapeDurationName(),
                "nifcloud_nas_exporter: Duration of a collector scrape.",
                META_LABELS
        );
    }

    private GaugeMetricFamily successFamily() {
        return new GaugeMetricFamily(
                catalog.scrapeSuccessName(),
                "nifcloud_nas_exporter: Whether a collector succeeded.",
                META_LABELS
        );
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "nas-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
