package com.nasexporter.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void readObjectAcceptsCommentsAndRejectsNonObjects() throws Exception {
        Path dir = Files.createTempDirectory("json-utils-");
        Path config = dir.resolve("exporter.json");
        Files.writeString(config, """
                {
                  // target
                  "nifcloud.region": "jp-west-1"
                }
                """);
        Path array = dir.resolve("array.json");
        Files.writeString(array, "[1,2]");

        JsonNode node = JsonUtils.readObject(config);
        assertEquals("jp-west-1", node.get("nifcloud.region").asText());

        IllegalStateException notObject = assertThrows(IllegalStateException.class, () -> JsonUtils.readObject(array));
        assertTrue(notObject.getMessage().contains("array.json"));
        IllegalStateException missing = assertThrows(IllegalStateException.class,
                () -> JsonUtils.readObject(dir.resolve("missing.json")));
        assertTrue(missing.getMessage().contains("missing.json"));
    }
}
