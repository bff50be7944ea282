package com.nasexporter.service.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves the Prometheus text exposition of the given registries, plus a landing page and a
 * health check.
 */
public class ExporterServer {
    private static final Logger LOGGER = Logger.getLogger(ExporterServer.class.getName());

    private final InetSocketAddress address;
    private final String telemetryPath;
    private final List<CollectorRegistry> registries;
    private final HandlerMetrics handlerMetrics;
    private final Semaphore scrapeSlots;

    private HttpServer server;
    private ExecutorService executor;

    public ExporterServer(
            InetSocketAddress address,
            String telemetryPath,
            int maxRequests,
            List<CollectorRegistry> registries,
            HandlerMetrics handlerMetrics
    ) {
        this.address = address;
        this.telemetryPath = telemetryPath;
        this.registries = List.copyOf(registries);
        this.handlerMetrics = handlerMetrics;
        this.scrapeSlots = maxRequests > 0 ? new Semaphore(maxRequests) : null;
    }

    public void start() {
        try {
            server = HttpServer.create(address, 0);
            executor = Executors.newCachedThreadPool(handlerThreadFactory());
            server.setExecutor(executor);
            server.createContext(telemetryPath, this::handleMetrics);
            server.createContext("/-/healthy", this::handleHealthy);
            if (!"/".equals(telemetryPath)) {
                server.createContext("/", this::handleLanding);
            }
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting exporter server on " + address, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return address.getPort();
        }
        return server.getAddress().getPort();
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureReadMethod(exchange)) {
            return;
        }
        if (scrapeSlots != null && !scrapeSlots.tryAcquire()) {
            writeText(exchange, 503, "text/plain; charset=utf-8", "Too many concurrent scrape requests.\n");
            return;
        }
        int status = 500;
        if (handlerMetrics != null) {
            handlerMetrics.started();
        }
        try {
            String body;
            try {
                body = render();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed gathering metrics", e);
                writeText(exchange, status, "text/plain; charset=utf-8", "Failed gathering metrics: " + e.getMessage() + "\n");
                return;
            }
            status = 200;
            writeText(exchange, status, TextFormat.CONTENT_TYPE_004, body);
        } finally {
            if (handlerMetrics != null) {
                handlerMetrics.finished(status);
            }
            if (scrapeSlots != null) {
                scrapeSlots.release();
            }
        }
    }

    private void handleHealthy(HttpExchange exchange) throws IOException {
        if (!ensureReadMethod(exchange)) {
            return;
        }
        writeText(exchange, 200, "text/plain; charset=utf-8", "OK\n");
    }

    private void handleLanding(HttpExchange exchange) throws IOException {
        if (!ensureReadMethod(exchange)) {
            return;
        }
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            writeText(exchange, 404, "text/plain; charset=utf-8", "404 page not found\n");
            return;
        }
        writeText(exchange, 200, "text/html; charset=utf-8", """
                <html>
                <head><title>NIFCLOUD NAS Exporter</title></head>
                <body>
                <h1>NIFCLOUD NAS Exporter</h1>
                <p><a href="%s">Metrics</a></p>
                </body>
                </html>
                """.formatted(telemetryPath));
    }

    String render() throws IOException {
        List<MetricFamilySamples> families = new ArrayList<>();
        for (CollectorRegistry registry : registries) {
            families.addAll(Collections.list(registry.metricFamilySamples()));
        }
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, Collections.enumeration(families));
        return writer.toString();
    }

    private boolean ensureReadMethod(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        if ("GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method)) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return false;
    }

    private void writeText(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static ThreadFactory handlerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "exporter-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
