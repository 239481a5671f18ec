package com.architecture.memory.traceback.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses the per-area source declarations and retriever overrides once at start-up.
 *
 * <p>Sources: {@code pharmacy:confluence(space=PHARM,labels=req|design);pharmacy:gitlab}.
 * Overrides: {@code pharmacy:confluence=docs|graph}. Malformed entries are skipped with a
 * warning; source order within an area follows declaration order.
 */
@Component
@Slf4j
public class SourceConfigResolver {

    private final List<String> businessAreas;
    private final Map<String, LinkedHashMap<String, SourceConfig>> sourcesByArea;
    private final Map<String, Map<String, List<String>>> overridesByArea;

    public SourceConfigResolver(TracebackProperties properties) {
        this.businessAreas = normalizeAreas(properties.getBusinessAreas());
        this.sourcesByArea = parseSources(properties.getSourcesConfig());
        this.overridesByArea = parseOverrides(properties.getRetrieverOverrides());
        log.info("[source-config] Areas={} sources={} overrides={}",
                businessAreas, sourcesByArea, overridesByArea);
    }

    public List<String> businessAreas() {
        return businessAreas;
    }

    public boolean isKnownArea(String businessArea) {
        return businessArea != null && businessAreas.contains(businessArea.toLowerCase(Locale.ROOT));
    }

    /**
     * Configured sources of an area in declaration order. Empty when the area declares none.
     */
    public LinkedHashMap<String, SourceConfig> resolveSources(String businessArea) {
        LinkedHashMap<String, SourceConfig> sources = sourcesByArea.get(normalize(businessArea));
        return sources == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sources);
    }

    public Map<String, List<String>> resolveOverrides(String businessArea) {
        Map<String, List<String>> overrides = overridesByArea.get(normalize(businessArea));
        return overrides == null ? Map.of() : overrides;
    }

    public SourceConfig getSourceConfig(String businessArea, String sourceName) {
        return resolveSources(businessArea).get(normalize(sourceName));
    }

    static LinkedHashMap<String, LinkedHashMap<String, SourceConfig>> parseSources(String raw) {
        LinkedHashMap<String, LinkedHashMap<String, SourceConfig>> result = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }

        for (String entry : raw.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            int colon = trimmed.indexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                log.warn("[source-config] Skipping malformed source entry '{}'", trimmed);
                continue;
            }

            String area = normalize(trimmed.substring(0, colon));
            String rest = trimmed.substring(colon + 1).trim();
            String sourceName;
            Map<String, String> values = new LinkedHashMap<>();

            int open = rest.indexOf('(');
            if (open >= 0) {
                if (!rest.endsWith(")")) {
                    log.warn("[source-config] Skipping source entry with unbalanced parentheses '{}'", trimmed);
                    continue;
                }
                sourceName = normalize(rest.substring(0, open));
                String body = rest.substring(open + 1, rest.length() - 1);
                if (!parseKeyValues(body, values)) {
                    log.warn("[source-config] Skipping source entry with malformed settings '{}'", trimmed);
                    continue;
                }
            } else {
                sourceName = normalize(rest);
            }

            if (sourceName.isEmpty()) {
                log.warn("[source-config] Skipping source entry without source name '{}'", trimmed);
                continue;
            }

            LinkedHashMap<String, SourceConfig> areaSources = result.computeIfAbsent(area, a -> new LinkedHashMap<>());
            SourceConfig existing = areaSources.get(sourceName);
            areaSources.put(sourceName, existing == null
                    ? new SourceConfig(sourceName, values)
                    : existing.mergedWith(values));
        }
        return result;
    }

    private static boolean parseKeyValues(String body, Map<String, String> values) {
        if (body.isBlank()) {
            return true;
        }
        for (String pair : body.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                return false;
            }
            String key = pair.substring(0, eq).trim();
            if (key.isEmpty()) {
                return false;
            }
            values.put(key, pair.substring(eq + 1).trim());
        }
        return true;
    }

    static Map<String, Map<String, List<String>>> parseOverrides(String raw) {
        Map<String, Map<String, List<String>>> result = new HashMap<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }

        for (String entry : raw.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            int colon = trimmed.indexOf(':');
            int eq = trimmed.indexOf('=');
            if (colon <= 0 || eq <= colon + 1) {
                log.warn("[source-config] Skipping malformed retriever override '{}'", trimmed);
                continue;
            }

            String area = normalize(trimmed.substring(0, colon));
            String source = normalize(trimmed.substring(colon + 1, eq));
            Set<String> retrievers = new LinkedHashSet<>();
            for (String name : trimmed.substring(eq + 1).split("\\|")) {
                String retriever = normalize(name);
                if (!retriever.isEmpty()) {
                    retrievers.add(retriever);
                }
            }
            if (retrievers.isEmpty()) {
                log.warn("[source-config] Skipping retriever override without retrievers '{}'", trimmed);
                continue;
            }

            result.computeIfAbsent(area, a -> new HashMap<>())
                    .put(source, Collections.unmodifiableList(new ArrayList<>(retrievers)));
        }
        return result;
    }

    private static List<String> normalizeAreas(List<String> areas) {
        List<String> normalized = new ArrayList<>();
        if (areas != null) {
            for (String area : areas) {
                String value = normalize(area);
                if (!value.isEmpty() && !normalized.contains(value)) {
                    normalized.add(value);
                }
            }
        }
        return Collections.unmodifiableList(normalized);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
