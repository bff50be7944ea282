package com.nasexporter.service;

import com.nasexporter.service.config.CommandLine;
import com.nasexporter.service.config.ConfigLoader;
import com.nasexporter.service.config.ExporterConfig;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC);

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(2))
            .build();
    private HttpServer nasApi;
    private ExecutorService nasApiExecutor;
    private Main.Exporter exporter;

    @AfterEach
    void tearDown() {
        if (exporter != null) {
            exporter.stop();
        }
        if (nasApi != null) {
            nasApi.stop(0);
            nasApiExecutor.shutdownNow();
        }
    }

    @Test
    void exposesNasMetricsAndExporterMetrics() throws Exception {
        startNasApi(200, """
                <GetMetricStatisticsResponse xmlns="https://nas.api.nifcloud.com/doc/2016-02-24/">
                  <GetMetricStatisticsResult>
                    <Datapoints>
                      <member><Timestamp>2026-02-09T19:58:00Z</Timestamp><Sum>5</Sum></member>
                      <member><Timestamp>2026-02-09T19:59:00Z</Timestamp><Sum>7</Sum></member>
                    </Datapoints>
                  </GetMetricStatisticsResult>
                </GetMetricStatisticsResponse>
                """);
        exporter = Main.assemble(config(), client, CLOCK);
        exporter.start();

        String body = scrape();

        assertTrue(body.contains("nifcloud_nas_free_storage_space{instance=\"nas001\",region=\"jp-east-1\",} 7.0"), body);
        assertTrue(body.contains("nifcloud_nas_private_write_traffic{instance=\"nas001\",region=\"jp-east-1\",} 7.0"));
        assertTrue(body.contains("nifcloud_nas_scrape_collector_success{metric_name=\"ReadIOPS\",} 1.0"));
        assertTrue(body.contains("nifcloud_nas_exporter_build_info{"));
        assertTrue(body.contains("jvm_threads_current"));
        assertTrue(body.contains("nifcloud_nas_exporter_http_requests_in_flight"));
    }

    @Test
    void failedFetchesStillReportDurationAndSuccess() throws Exception {
        startNasApi(403, "<ErrorResponse><Error><Code>AuthFailure</Code><Message>denied</Message></Error></ErrorResponse>");
        exporter = Main.assemble(config("--web.disable-exporter-metrics"), client, CLOCK);
        exporter.start();

        String body = scrape();

        assertFalse(body.contains("nifcloud_nas_free_storage_space{"));
        assertTrue(body.contains("nifcloud_nas_scrape_collector_success{metric_name=\"FreeStorageSpace\",} 0.0"));
        assertTrue(body.contains("nifcloud_nas_scrape_collector_duration_seconds{metric_name=\"FreeStorageSpace\",}"));
        assertTrue(body.contains("nifcloud_nas_exporter_build_info{"));
        assertFalse(body.contains("jvm_threads_current"));
        assertFalse(body.contains("nifcloud_nas_exporter_http_requests_in_flight"));
    }

    private String scrape() throws Exception {
        URI uri = URI.create("http://127.0.0.1:" + exporter.server().actualPort() + "/metrics");
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode());
        return response.body();
    }

    private ExporterConfig config(String... extraArgs) {
        String[] args = new String[extraArgs.length + 2];
        args[0] = "--web.listen-address=127.0.0.1:0";
        args[1] = "--nifcloud.endpoint=http://127.0.0.1:" + nasApi.getAddress().getPort() + "/";
        System.arraycopy(extraArgs, 0, args, 2, extraArgs.length);
        return ConfigLoader.load(CommandLine.parse(args), Map.of(
                "NIFCLOUD_NAS_INSTANCE_ID", "nas001",
                "NIFCLOUD_ACCESS_KEY_ID", "AKID",
                "NIFCLOUD_SECRET_ACCESS_KEY", "secret"
        ));
    }

    private void startNasApi(int status, String body) throws Exception {
        nasApiExecutor = Executors.newFixedThreadPool(16);
        nasApi = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        nasApi.setExecutor(nasApiExecutor);
        nasApi.createContext("/", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/xml;charset=UTF-8");
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        nasApi.start();
    }
}
