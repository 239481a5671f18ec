package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.config.SourceConfig;
import com.architecture.memory.traceback.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a declared source block into the settings a fetcher factory expects. Blocks that
 * miss a required key are rejected with an error log.
 */
@Component
@Slf4j
public class SourceSettingsTranslator {

    static final String DEFAULT_CODE_LANGUAGES = "python|java|sql";

    public Optional<Map<String, Object>> translate(String businessArea, SourceType sourceType, SourceConfig config) {
        Map<String, Object> settings = new HashMap<>();

        switch (sourceType) {
            case CONFLUENCE -> {
                String spaceKey = firstPresent(config, "space", "space_key", "space_id");
                if (spaceKey == null) {
                    return missing(businessArea, sourceType, "space", config);
                }
                settings.put("space_key", spaceKey);
                settings.put("labels", config.getList("labels"));
            }
            case FIRESTORE -> {
                String collection = firstPresent(config, "collection", "collection_name");
                if (collection == null) {
                    return missing(businessArea, sourceType, "collection", config);
                }
                settings.put("collection_name", collection);
            }
            case GITLAB -> {
                String project = firstPresent(config, "project", "project_path");
                List<String> projects = config.getList("projects");
                if (!projects.isEmpty()) {
                    project = projects.get(0);
                    if (projects.size() > 1) {
                        log.warn("[ingestion] Multiple GitLab projects configured for area={}, using {} and skipping {}",
                                businessArea, project, projects.subList(1, projects.size()));
                    }
                }
                if (project == null) {
                    return missing(businessArea, sourceType, "project", config);
                }
                settings.put("project_path", project);
            }
            case CODE -> {
                String origin = config.getOrDefault("source", "gitlab");
                String projectPath = firstPresent(config, "project_path", "project");
                if ("gitlab".equals(origin) && projectPath == null) {
                    return missing(businessArea, sourceType, "project_path", config);
                }
                settings.put("source", origin);
                settings.put("project_path", projectPath);
                settings.put("languages", config.getList("languages", DEFAULT_CODE_LANGUAGES));
            }
            case OPENMETADATA -> {
                String service = firstPresent(config, "service", "service_name");
                if (service == null) {
                    return missing(businessArea, sourceType, "service", config);
                }
                settings.put("service", service);
                settings.put("api_url", config.get("api_url"));
                settings.put("api_token", config.get("api_token"));
            }
            case CODEQL -> {
                log.debug("[ingestion] codeql is handled by code graph analysis, not ingestion (area={})", businessArea);
                return Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
        return Optional.of(settings);
    }

    private static String firstPresent(SourceConfig config, String... keys) {
        for (String key : keys) {
            String value = config.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static Optional<Map<String, Object>> missing(String businessArea, SourceType sourceType, String key,
                                                         SourceConfig config) {
        log.error("[ingestion] {} source of area={} is missing '{}' configuration: {}",
                sourceType.value(), businessArea, key, config);
        return Optional.empty();
    }
}
