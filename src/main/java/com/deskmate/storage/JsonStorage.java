package com.deskmate.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Reads a JSON object file as an ordered map. A missing file yields an empty map;
     * a file whose root is not an object is rejected.
     */
    public static Map<String, Object> readJsonMap(Path path) throws IOException {
        if (!Files.exists(path)) {
            return Collections.emptyMap();
        }
        if (!mapper.readTree(path.toFile()).isObject()) {
            throw new IOException("Expected a JSON object in " + path);
        }
        Map<String, Object> data = mapper.readValue(path.toFile(), MAP_TYPE);
        return data != null ? data : Collections.emptyMap();
    }

    public static void writeJsonMap(Path path, Map<String, ?> data) throws IOException {
        ensureParent(path);
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }

    public static <T> T readJson(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        return mapper.readValue(path.toFile(), type);
    }

    public static void writeJson(Path path, Object data) throws IOException {
        ensureParent(path);
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }

    private static void ensureParent(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
