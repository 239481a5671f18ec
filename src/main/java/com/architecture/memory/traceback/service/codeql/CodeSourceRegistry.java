package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.SourceConfig;
import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.SourceNotFoundException;
import com.architecture.memory.traceback.exception.TracebackException;
import com.architecture.memory.traceback.model.CodeSource;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable catalog of code sources registered for CodeQL analysis.
 *
 * <p>The whole catalog lives in one JSON file that is loaded at start-up and rewritten on
 * every mutation through a temp file and an atomic rename, so a crash never leaves a
 * truncated file behind. Mutations are serialized on this instance.
 */
@Service
@Slf4j
public class CodeSourceRegistry {

    private final Path registryPath;
    private final boolean codeqlEnabled;
    private final SourceConfigResolver sourceConfigResolver;
    private final ObjectMapper objectMapper;
    private final Map<String, CodeSource> sources = new LinkedHashMap<>();

    public CodeSourceRegistry(TracebackProperties properties, SourceConfigResolver sourceConfigResolver) {
        this(properties.getCodeql().getRegistryPath(), properties.getCodeql().isEnabled(), sourceConfigResolver);
    }

    CodeSourceRegistry(Path registryPath, boolean codeqlEnabled, SourceConfigResolver sourceConfigResolver) {
        this.registryPath = registryPath;
        this.codeqlEnabled = codeqlEnabled;
        this.sourceConfigResolver = sourceConfigResolver;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public static String sourceIdOf(String businessArea, String sourceType, String path) {
        return businessArea + "_" + sourceType + "_" + path.replace('/', '_').replace('\\', '_');
    }

    public synchronized String register(String businessArea, String sourceType, String path, List<String> languages) {
        return register(businessArea, sourceType, path, languages, null, null, true, Map.of());
    }

    /**
     * Register or overwrite a source. The id defaults to {@link #sourceIdOf}, the name to
     * the path.
     */
    public synchronized String register(String businessArea, String sourceType, String path, List<String> languages,
                                        String name, String sourceId, boolean enabled, Map<String, Object> metadata) {
        String id = sourceId != null && !sourceId.isBlank() ? sourceId : sourceIdOf(businessArea, sourceType, path);
        if (sources.containsKey(id)) {
            log.warn("[code-registry] Source {} already registered, overwriting", id);
        }

        CodeSource source = CodeSource.builder()
                .sourceId(id)
                .businessArea(businessArea)
                .sourceType(sourceType)
                .path(path)
                .languages(new ArrayList<>(languages))
                .name(name != null && !name.isBlank() ? name : path)
                .enabled(enabled)
                .metadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata))
                .build();

        sources.put(id, source);
        persist();
        log.info("[code-registry] Registered source {} area={} type={} languages={}", id, businessArea, sourceType, languages);
        return id;
    }

    public synchronized Optional<CodeSource> get(String sourceId) {
        CodeSource source = sources.get(sourceId);
        return source == null ? Optional.empty() : Optional.of(source.toBuilder().build());
    }

    public synchronized List<CodeSource> listSources(String businessArea, String sourceType, boolean enabledOnly) {
        return sources.values().stream()
                .filter(source -> businessArea == null || businessArea.equals(source.getBusinessArea()))
                .filter(source -> sourceType == null || sourceType.equals(source.getSourceType()))
                .filter(source -> !enabledOnly || source.isEnabled())
                .map(source -> source.toBuilder().build())
                .collect(Collectors.toList());
    }

    /**
     * Record the revision a source was analyzed at and stamp the analysis time. Every
     * language of the source is marked as built from that revision.
     *
     * @throws SourceNotFoundException when the id is unknown
     */
    public synchronized void updateCommitHash(String sourceId, String commitHash) {
        CodeSource source = require(sourceId);
        Map<String, String> commits = source.getLanguageCommits() == null
                ? new HashMap<>() : new HashMap<>(source.getLanguageCommits());
        commits.replaceAll((language, previous) -> commitHash);
        if (source.getLanguages() != null) {
            source.getLanguages().forEach(language -> commits.put(language, commitHash));
        }
        source.setLanguageCommits(commits);
        source.setLastAnalyzedCommit(commitHash);
        source.setLastAnalyzedTime(Instant.now());
        persist();
        log.info("[code-registry] Source {} analyzed at {}", sourceId, commitHash);
    }

    /**
     * Record the revision one language database was built from; also advances the
     * source-wide revision.
     */
    public synchronized void updateLanguageCommit(String sourceId, String language, String commitHash) {
        CodeSource source = require(sourceId);
        Map<String, String> commits = source.getLanguageCommits() == null
                ? new HashMap<>() : new HashMap<>(source.getLanguageCommits());
        commits.put(language, commitHash);
        source.setLanguageCommits(commits);
        source.setLastAnalyzedCommit(commitHash);
        source.setLastAnalyzedTime(Instant.now());
        persist();
        log.info("[code-registry] Source {} language={} built at {}", sourceId, language, commitHash);
    }

    public synchronized void delete(String sourceId) {
        require(sourceId);
        sources.remove(sourceId);
        persist();
        log.info("[code-registry] Deleted source {}", sourceId);
    }

    /**
     * CodeQL runs for an area only when the global switch is on and the area declares a
     * non-empty {@code codeql} block that is not disabled.
     */
    public boolean isCodeQlEnabled(String businessArea) {
        if (!codeqlEnabled) {
            return false;
        }
        SourceConfig codeql = sourceConfigResolver.getSourceConfig(businessArea, "codeql");
        return codeql != null && !codeql.isEmpty() && codeql.getBoolean("enabled", true);
    }

    private CodeSource require(String sourceId) {
        CodeSource source = sources.get(sourceId);
        if (source == null) {
            throw new SourceNotFoundException(sourceId);
        }
        return source;
    }

    private void load() {
        if (!Files.exists(registryPath)) {
            log.info("[code-registry] No registry file at {}, starting empty", registryPath);
            return;
        }
        try {
            List<CodeSource> loaded = objectMapper.readValue(registryPath.toFile(), new TypeReference<List<CodeSource>>() {
            });
            loaded.forEach(source -> sources.put(source.getSourceId(), source));
            log.info("[code-registry] Loaded {} sources from {}", sources.size(), registryPath);
        } catch (IOException e) {
            log.error("[code-registry] Could not read {}, starting empty: {}", registryPath, e.getMessage());
        }
    }

    private void persist() {
        try {
            Path parent = registryPath.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, registryPath.getFileName().toString(), ".tmp");

            List<CodeSource> snapshot = sources.values().stream()
                    .sorted(Comparator.comparing(CodeSource::getSourceId))
                    .collect(Collectors.toList());
            objectMapper.writeValue(temp.toFile(), snapshot);

            try {
                Files.move(temp, registryPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("[code-registry] Failed to write {}: {}", registryPath, e.getMessage());
            throw new TracebackException("Failed to persist code source registry", e);
        }
    }
}
