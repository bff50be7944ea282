package com.nasexporter.core.model;

public record TargetInstance(String identifier, String region) {
    public TargetInstance {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("NAS instance identifier is required");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region is required");
        }
    }
}
