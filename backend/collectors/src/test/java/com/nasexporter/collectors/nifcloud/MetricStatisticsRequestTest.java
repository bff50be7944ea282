package com.nasexporter.collectors.nifcloud;

import com.nasexporter.core.model.TargetInstance;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricStatisticsRequestTest {
    private static final TargetInstance TARGET = new TargetInstance("nas-prod-01", "jp-east-1");

    @Test
    void windowEndsAtNowAndIsFormattedInUtc() {
        MetricStatisticsRequest request = MetricStatisticsRequest.of(
                "FreeStorageSpace",
                TARGET,
                Instant.parse("2026-02-09T20:00:00Z"),
                Duration.ofSeconds(180),
                "N2016-02-24"
        );

        Map<String, String> params = request.parameters();
        assertEquals("GetMetricStatistics", params.get("Action"));
        assertEquals("N2016-02-24", params.get("Version"));
        assertEquals("NASInstanceIdentifier", params.get("Dimensions.member.1.Name"));
        assertEquals("nas-prod-01", params.get("Dimensions.member.1.Value"));
        assertEquals("FreeStorageSpace", params.get("MetricName"));
        assertEquals("2026-02-09 19:57:00", params.get("StartTime"));
        assertEquals("2026-02-09 20:00:00", params.get("EndTime"));
    }

    @Test
    void formBodyUsesRfc3986Encoding() {
        MetricStatisticsRequest request = MetricStatisticsRequest.of(
                "ReadIOPS",
                TARGET,
                Instant.parse("2026-02-09T20:00:00Z"),
                Duration.ofSeconds(60),
                "N2016-02-24"
        );

        String body = request.formBody();
        assertEquals(
                "Action=GetMetricStatistics&Version=N2016-02-24"
                        + "&Dimensions.member.1.Name=NASInstanceIdentifier"
                        + "&Dimensions.member.1.Value=nas-prod-01"
                        + "&MetricName=ReadIOPS"
                        + "&StartTime=2026-02-09%2019%3A59%3A00"
                        + "&EndTime=2026-02-09%2020%3A00%3A00",
                body
        );
        assertEquals("a~b%2Ac%20d", MetricStatisticsRequest.percentEncode("a~b*c d"));
    }

    @Test
    void blankMetricNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MetricStatisticsRequest.of(
                " ", TARGET, Instant.EPOCH, Duration.ofSeconds(180), "N2016-02-24"));
    }
}
