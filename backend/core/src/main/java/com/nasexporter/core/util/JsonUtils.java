package com.nasexporter.core.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class JsonUtils {
    private static final ObjectMapper OBJECT_MAPPER = buildMapper();

    private JsonUtils() {
    }

    public static JsonNode readObject(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode node = OBJECT_MAPPER.readTree(in);
            if (node == null || !node.isObject()) {
                throw new IllegalStateException("Expected a JSON object in " + path);
            }
            return node;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading JSON from " + path, e);
        }
    }

    private static ObjectMapper buildMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        return mapper;
    }
}
