package com.nasexporter.core.model;

import java.util.Objects;

public record MetricDefinition(
        String name,
        String exposedName,
        String help
) {
    public MetricDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(exposedName, "exposedName is required");
        Objects.requireNonNull(help, "help is required");
    }
}
