package com.architecture.memory.traceback.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A repository or directory registered for CodeQL analysis within one business area.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CodeSource {

    public static final String TYPE_GITLAB = "gitlab";
    public static final String TYPE_FILESYSTEM = "filesystem";

    private String sourceId;
    private String businessArea;
    private String sourceType;
    private String path;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    private String name;

    @Builder.Default
    private boolean enabled = true;

    private String lastAnalyzedCommit;
    private Instant lastAnalyzedTime;

    /**
     * Revision each language's stored database was built from.
     */
    @Builder.Default
    private Map<String, String> languageCommits = new HashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * Repository key used in graph tags and database paths.
     */
    public String repoName() {
        return path;
    }

    /**
     * Revision the stored database of {@code language} reflects. Falls back to the
     * source-wide revision for entries written before per-language tracking.
     */
    public String analyzedCommit(String language) {
        if (languageCommits != null && languageCommits.containsKey(language)) {
            return languageCommits.get(language);
        }
        return languageCommits == null || languageCommits.isEmpty() ? lastAnalyzedCommit : null;
    }
}
