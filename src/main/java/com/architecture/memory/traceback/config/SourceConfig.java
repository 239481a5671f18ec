package com.architecture.memory.traceback.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value settings of one source in one business area. List values are pipe separated.
 */
public final class SourceConfig {

    private final String sourceName;
    private final Map<String, String> values;

    public SourceConfig(String sourceName, Map<String, String> values) {
        this.sourceName = sourceName;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String sourceName() {
        return sourceName;
    }

    public Map<String, String> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String get(String key) {
        return values.get(key);
    }

    public String getOrDefault(String key, String defaultValue) {
        String value = values.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public List<String> getList(String key) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split("\\|")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    public List<String> getList(String key, String defaultValue) {
        List<String> items = getList(key);
        return items.isEmpty() ? Arrays.asList(defaultValue.split("\\|")) : items;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    SourceConfig mergedWith(Map<String, String> more) {
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(more);
        return new SourceConfig(sourceName, merged);
    }

    @Override
    public String toString() {
        return sourceName + values;
    }
}
