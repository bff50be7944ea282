package com.nasexporter.service;

import com.nasexporter.collectors.nas.NasCollector;
import com.nasexporter.collectors.nifcloud.NasMetricFetcher;
import com.nasexporter.core.model.MetricCatalog;
import com.nasexporter.service.api.BuildInfo;
import com.nasexporter.service.api.ExporterServer;
import com.nasexporter.service.api.HandlerMetrics;
import com.nasexporter.service.config.CommandLine;
import com.nasexporter.service.config.ConfigLoader;
import com.nasexporter.service.config.ExporterConfig;
import com.nasexporter.service.config.ExporterOptions;
import com.nasexporter.service.http.HttpClientFactory;
import com.nasexporter.service.logging.LoggingSetup;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        ExporterOptions options = new ExporterOptions();
        ExporterConfig config;
        try {
            CommandLine commandLine = options.parse(args);
            if (commandLine.helpRequested()) {
                System.out.print(options.usage());
                return;
            }
            if (commandLine.versionRequested()) {
                System.out.println(BuildInfo.describe());
                return;
            }
            config = ConfigLoader.load(commandLine, System.getenv());
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("nifcloud_nas_exporter: error: " + e.getMessage());
            System.err.print(options.usage());
            System.exit(2);
            return;
        }

        LoggingSetup.configure(config.logLevel());
        LOGGER.info("Starting " + BuildInfo.describe());
        LOGGER.info("Target NAS instance " + config.target().identifier() + " in " + config.target().region()
                + " via " + config.api().endpointFor(config.target()));

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5), config.trustStoreConfig());
        Exporter exporter = assemble(config, httpClient, Clock.systemUTC());
        exporter.start();
        LOGGER.info("Listening on " + config.listenAddress() + ", metrics at " + config.telemetryPath());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            exporter.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    /**
     * Wires the collector, its registries and the HTTP server without starting anything.
     */
    static Exporter assemble(ExporterConfig config, HttpClient httpClient, Clock clock) {
        NasCollector collector = new NasCollector(
                new NasMetricFetcher(httpClient, config.api(), clock),
                MetricCatalog.nas(),
                config.target()
        );

        CollectorRegistry nasRegistry = new CollectorRegistry();
        collector.register(nasRegistry);
        BuildInfo.register(nasRegistry);

        List<CollectorRegistry> registries = new ArrayList<>();
        registries.add(nasRegistry);
        HandlerMetrics handlerMetrics = null;
        if (config.exporterMetricsEnabled()) {
            CollectorRegistry exporterRegistry = new CollectorRegistry();
            DefaultExports.register(exporterRegistry);
            handlerMetrics = HandlerMetrics.register(exporterRegistry);
            registries.add(exporterRegistry);
        }

        ExporterServer server = new ExporterServer(
                config.listenAddress(),
                config.telemetryPath(),
                config.maxRequests(),
                registries,
                handlerMetrics
        );
        return new Exporter(server, collector);
    }

    record Exporter(ExporterServer server, NasCollector collector) {
        void start() {
            server.start();
        }

        void stop() {
            server.stop();
            collector.close();
        }
    }
}
