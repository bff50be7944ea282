package com.nasexporter.core.model;

import java.time.Instant;

public record DataPoint(Instant timestamp, double value) {
}
