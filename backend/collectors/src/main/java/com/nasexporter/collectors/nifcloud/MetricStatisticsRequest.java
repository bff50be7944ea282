package com.nasexporter.collectors.nifcloud;

import com.nasexporter.core.model.TargetInstance;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Form parameters of a {@code GetMetricStatistics} query covering the trailing window that ends at
 * {@code now}.
 */
public final class MetricStatisticsRequest {
    static final String ACTION = "GetMetricStatistics";
    static final String DIMENSION_NAME = "NASInstanceIdentifier";
    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Map<String, String> parameters;

    private MetricStatisticsRequest(Map<String, String> parameters) {
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public static MetricStatisticsRequest of(
            String metricName,
            TargetInstance target,
            Instant now,
            Duration window,
            String apiVersion
    ) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Action", ACTION);
        parameters.put("Version", apiVersion);
        parameters.put("Dimensions.member.1.Name", DIMENSION_NAME);
        parameters.put("Dimensions.member.1.Value", target.identifier());
        parameters.put("MetricName", metricName);
        parameters.put("StartTime", TIMESTAMP_FORMAT.format(now.minus(window)));
        parameters.put("EndTime", TIMESTAMP_FORMAT.format(now));
        return new MetricStatisticsRequest(parameters);
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public String formBody() {
        return parameters.entrySet().stream()
                .map(entry -> percentEncode(entry.getKey()) + "=" + percentEncode(entry.getValue()))
                .collect(Collectors.joining("&"));
    }

    // RFC 3986 unreserved characters stay literal; everything else is %XX.
    static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
