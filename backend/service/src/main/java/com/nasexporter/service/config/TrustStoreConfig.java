package com.nasexporter.service.config;

import java.nio.file.Path;

public record TrustStoreConfig(Path path, String password) {
    @Override
    public String toString() {
        return "TrustStoreConfig[path=" + path + ", password=****]";
    }
}
