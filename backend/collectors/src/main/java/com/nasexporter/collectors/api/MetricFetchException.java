package com.nasexporter.collectors.api;

public class MetricFetchException extends RuntimeException {
    private final FetchErrorKind kind;

    public MetricFetchException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetricFetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FetchErrorKind kind() {
        return kind;
    }
}
