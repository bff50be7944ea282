package com.nasexporter.collectors.nifcloud;

import com.nasexporter.collectors.api.FetchErrorKind;
import com.nasexporter.collectors.api.MetricFetchException;
import com.nasexporter.collectors.api.MetricFetcher;
import com.nasexporter.collectors.config.NasApiConfig;
import com.nasexporter.core.model.DataPoint;
import com.nasexporter.core.model.TargetInstance;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MetricFetcher} backed by the NIFCLOUD NAS {@code GetMetricStatistics} API.
 */
public class NasMetricFetcher implements MetricFetcher {
    static final String SERVICE = "nas";
    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";

    private final HttpClient httpClient;
    private final NasApiConfig config;
    private final Clock clock;

    public NasMetricFetcher(HttpClient httpClient, NasApiConfig config, Clock clock) {
        this.httpClient = httpClient;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public double fetch(String metricName, TargetInstance target) {
        HttpRequest request = buildRequest(metricName, target);
        HttpResponse<String> response = send(request);

        if (response.statusCode() / 100 != 2) {
            String detail = MetricStatisticsParser.errorSummary(response.body())
                    .map(summary -> ": " + summary)
                    .orElse("");
            throw new MetricFetchException(FetchErrorKind.TRANSPORT,
                    "GetMetricStatistics returned HTTP " + response.statusCode() + detail);
        }

        List<DataPoint> points = MetricStatisticsParser.parseDatapoints(response.body());
        return latest(points)
                .map(DataPoint::value)
                .orElseThrow(() -> new MetricFetchException(FetchErrorKind.NO_DATA, "fetched no datapoints"));
    }

    HttpRequest buildRequest(String metricName, TargetInstance target) {
        try {
            Instant now = clock.instant();
            URI endpoint = config.endpointFor(target);
            byte[] body = MetricStatisticsRequest.of(metricName, target, now, config.window(), config.apiVersion())
                    .formBody()
                    .getBytes(StandardCharsets.UTF_8);
            Map<String, String> authHeaders = new SignatureV4Signer(config.credentials(), target.region(), SERVICE)
                    .sign("POST", endpoint, CONTENT_TYPE, body, now);

            HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .timeout(config.requestTimeout())
                    .header("Content-Type", CONTENT_TYPE);
            authHeaders.forEach(builder::header);
            return builder.build();
        } catch (RuntimeException e) {
            throw new MetricFetchException(FetchErrorKind.REQUEST_BUILD, "failed building request: " + e.getMessage(), e);
        }
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new MetricFetchException(FetchErrorKind.TRANSPORT, "request to " + request.uri() + " timed out", e);
        } catch (IOException e) {
            throw new MetricFetchException(FetchErrorKind.TRANSPORT,
                    "request to " + request.uri() + " failed: " + rootMessage(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricFetchException(FetchErrorKind.TRANSPORT, "interrupted while waiting for " + request.uri(), e);
        }
    }

    /**
     * Picks the point with the strictly latest timestamp; among equal timestamps the first one
     * seen is kept.
     */
    static Optional<DataPoint> latest(List<DataPoint> points) {
        DataPoint latest = null;
        for (DataPoint point : points) {
            if (latest == null || point.timestamp().isAfter(latest.timestamp())) {
                latest = point;
            }
        }
        return Optional.ofNullable(latest);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
