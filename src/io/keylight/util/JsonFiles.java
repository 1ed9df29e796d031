package io.keylight.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

public class JsonFiles {
    private static final Gson GSON = new GsonBuilder()
            .enableComplexMapKeySerialization()
            .create();

    public static Map<String, Object> getJsonStringMapFromResources(String resourcePath) {
        try (InputStream inputStream = JsonFiles.class.getResourceAsStream("/" + resourcePath)) {
            if (inputStream == null)
                throw new IllegalStateException("Resource not found on the classpath: " + resourcePath);
            return getJsonStringMap(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws IOException when the file cannot be read
     * @throws JsonParseException when the file is not a JSON object
     */
    public static Map<String, Object> getJsonStringMap(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return getJsonStringMap(reader);
        }
    }

    private static Map<String, Object> getJsonStringMap(Reader reader) throws IOException {
        try (reader) {
            TypeToken<Map<String, Object>> typeToken = new TypeToken<>() {};
            Map<String, Object> map = GSON.fromJson(reader, typeToken);
            return map == null ? new HashMap<>() : map;
        }
    }

    /**
     * Copies {@code overrides} onto {@code base}. Nested objects are merged key by key, anything else is replaced.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        var merged = new HashMap<>(base);
        for (var entry : overrides.entrySet()) {
            var existing = merged.get(entry.getKey());
            if (existing instanceof Map baseChild && entry.getValue() instanceof Map overrideChild) {
                merged.put(entry.getKey(), merge((Map<String, Object>) baseChild, (Map<String, Object>) overrideChild));
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }
}
