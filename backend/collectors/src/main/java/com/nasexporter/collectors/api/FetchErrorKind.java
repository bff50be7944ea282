package com.nasexporter.collectors.api;

public enum FetchErrorKind {
    REQUEST_BUILD,
    TRANSPORT,
    NO_DATA,
    PARSE_FAILURE
}
