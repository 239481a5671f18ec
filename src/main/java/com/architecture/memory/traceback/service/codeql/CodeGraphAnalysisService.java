package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.SourceConfig;
import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.dto.AreaAnalysisResult;
import com.architecture.memory.traceback.dto.GraphEmissionResult;
import com.architecture.memory.traceback.dto.LanguageAnalysisResult;
import com.architecture.memory.traceback.dto.SourceAnalysisResult;
import com.architecture.memory.traceback.model.CodeSource;
import com.architecture.memory.traceback.service.graph.GraphEmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orchestrates the code graph pipeline for registered sources:
 * checkout, revision-gated database build, query battery and graph emission.
 *
 * <p>Each language of a source is processed independently; a failure in one language is
 * recorded in its outcome and the next language still runs. The (area, repo) graph is
 * cleared once per run, before the first emission, so languages of the same source add
 * up instead of replacing each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeGraphAnalysisService {

    static final List<String> DEFAULT_CONFIG_LANGUAGES = List.of("python", "java");

    private final CodeSourceRegistry registry;
    private final SourceConfigResolver sourceConfigResolver;
    private final SourceCheckoutService checkoutService;
    private final CodeQlDatabaseBuilder databaseBuilder;
    private final CodeQlQueryExecutor queryExecutor;
    private final GraphEmitter graphEmitter;
    private final Map<String, AnalysisCancellationToken> runningAnalyses = new ConcurrentHashMap<>();

    public SourceAnalysisResult analyzeSource(String sourceId) {
        return analyzeSource(sourceId, AnalysisCancellationToken.none());
    }

    public SourceAnalysisResult analyzeSource(String sourceId, AnalysisCancellationToken token) {
        Optional<CodeSource> found = registry.get(sourceId);
        if (found.isEmpty()) {
            return SourceAnalysisResult.error(sourceId, null, "Source not found: " + sourceId);
        }

        CodeSource source = found.get();
        String businessArea = source.getBusinessArea();
        if (!source.isEnabled()) {
            return SourceAnalysisResult.skipped(sourceId, businessArea, SourceAnalysisResult.REASON_SOURCE_DISABLED);
        }
        if (!registry.isCodeQlEnabled(businessArea)) {
            return SourceAnalysisResult.skipped(sourceId, businessArea, SourceAnalysisResult.REASON_AREA_DISABLED);
        }

        log.info("[code-graph] Starting analysis source={} area={} repo={} languages={}",
                sourceId, businessArea, source.repoName(), source.getLanguages());

        SourceAnalysisResult result = SourceAnalysisResult.builder()
                .sourceId(sourceId)
                .businessArea(businessArea)
                .status(SourceAnalysisResult.STATUS_SUCCESS)
                .build();

        Path sourceRoot;
        try {
            sourceRoot = checkoutService.checkout(source);
        } catch (RuntimeException e) {
            log.error("[code-graph] Checkout failed for source={}: {}", sourceId, e.getMessage());
            for (String language : source.getLanguages()) {
                result.getLanguages().put(language, failed(language, "Checkout failed: " + e.getMessage()));
            }
            return result;
        }

        boolean graphCleared = false;
        for (String language : source.getLanguages()) {
            LanguageAnalysisResult outcome = analyzeLanguage(source, language, sourceRoot, token, !graphCleared);
            graphCleared |= outcome.getGraph() != null;
            result.getLanguages().put(language, outcome);
        }

        log.info("[code-graph] Finished analysis source={} area={}", sourceId, businessArea);
        return result;
    }

    @Async("analysisExecutor")
    public CompletableFuture<SourceAnalysisResult> analyzeSourceAsync(String sourceId) {
        AnalysisCancellationToken token = new AnalysisCancellationToken();
        runningAnalyses.put(sourceId, token);
        try {
            return CompletableFuture.completedFuture(analyzeSource(sourceId, token));
        } catch (RuntimeException e) {
            log.error("[code-graph] Background analysis of {} failed: {}", sourceId, e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        } finally {
            runningAnalyses.remove(sourceId, token);
        }
    }

    /**
     * Request cancellation of a background analysis.
     *
     * @return false when no analysis of the source is running
     */
    public boolean cancelAnalysis(String sourceId) {
        AnalysisCancellationToken token = runningAnalyses.get(sourceId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("[code-graph] Cancellation requested for source={}", sourceId);
        return true;
    }

    /**
     * Unregister a source and drop its stored databases. The emitted graph is left in place.
     *
     * @throws com.architecture.memory.traceback.exception.SourceNotFoundException when the id is unknown
     */
    public void removeSource(String sourceId) {
        cancelAnalysis(sourceId);
        List<String> removed = databaseBuilder.deleteDatabases(sourceId);
        registry.delete(sourceId);
        log.info("[code-graph] Removed source={} databases={}", sourceId, removed);
    }

    public AreaAnalysisResult analyzeBusinessArea(String businessArea) {
        if (!registry.isCodeQlEnabled(businessArea)) {
            return AreaAnalysisResult.builder()
                    .businessArea(businessArea)
                    .status(SourceAnalysisResult.STATUS_SKIPPED)
                    .reason(SourceAnalysisResult.REASON_AREA_DISABLED)
                    .build();
        }

        List<CodeSource> sources = registry.listSources(businessArea, null, true);
        if (sources.isEmpty()) {
            return AreaAnalysisResult.builder()
                    .businessArea(businessArea)
                    .status(SourceAnalysisResult.STATUS_SKIPPED)
                    .reason(SourceAnalysisResult.REASON_NO_SOURCES)
                    .build();
        }

        log.info("[code-graph] Analyzing {} sources of area={}", sources.size(), businessArea);
        Map<String, SourceAnalysisResult> results = new LinkedHashMap<>();
        for (CodeSource source : sources) {
            try {
                results.put(source.getSourceId(), analyzeSource(source.getSourceId()));
            } catch (RuntimeException e) {
                log.error("[code-graph] Analysis of {} failed: {}", source.getSourceId(), e.getMessage(), e);
                results.put(source.getSourceId(), SourceAnalysisResult.error(source.getSourceId(), businessArea, e.getMessage()));
            }
        }

        return AreaAnalysisResult.builder()
                .businessArea(businessArea)
                .status(SourceAnalysisResult.STATUS_SUCCESS)
                .sources(results)
                .build();
    }

    /**
     * Register the repositories of an area's {@code codeql(enabled=..., repos=a|b)} block as
     * gitlab sources. Sources that are already registered keep their analysis state.
     */
    public List<String> registerSourcesFromConfig(String businessArea, SourceConfig codeqlConfig) {
        if (!codeqlConfig.getBoolean("enabled", true)) {
            log.info("[code-graph] CodeQL disabled for area={}", businessArea);
            return List.of();
        }

        List<String> repos = codeqlConfig.getList("repos");
        if (repos.isEmpty()) {
            log.warn("[code-graph] No repos configured for CodeQL in area={}", businessArea);
            return List.of();
        }

        List<String> sourceIds = new ArrayList<>();
        for (String repo : repos) {
            String sourceId = CodeSourceRegistry.sourceIdOf(businessArea, CodeSource.TYPE_GITLAB, repo);
            if (registry.get(sourceId).isPresent()) {
                log.debug("[code-graph] Source {} already registered", sourceId);
                sourceIds.add(sourceId);
                continue;
            }
            sourceIds.add(registry.register(businessArea, CodeSource.TYPE_GITLAB, repo, DEFAULT_CONFIG_LANGUAGES,
                    businessArea + " - " + repo, sourceId, true, Map.of()));
        }

        log.info("[code-graph] Registered {} sources from config for area={}", sourceIds.size(), businessArea);
        return sourceIds;
    }

    public Map<String, List<String>> syncRegisteredSourcesFromConfig() {
        Map<String, List<String>> registered = new LinkedHashMap<>();
        for (String businessArea : sourceConfigResolver.businessAreas()) {
            SourceConfig codeqlConfig = sourceConfigResolver.getSourceConfig(businessArea, "codeql");
            if (codeqlConfig == null || codeqlConfig.isEmpty()) {
                continue;
            }
            registered.put(businessArea, registerSourcesFromConfig(businessArea, codeqlConfig));
        }
        return registered;
    }

    private LanguageAnalysisResult analyzeLanguage(CodeSource source, String language, Path sourceRoot,
                                                   AnalysisCancellationToken token, boolean clearGraph) {
        String sourceId = source.getSourceId();
        try {
            if (token.isCancelled()) {
                return cancelled(language);
            }
            DatabaseBuildOutcome database = databaseBuilder.buildDatabase(sourceId, language, sourceRoot);

            if (token.isCancelled()) {
                return cancelled(language);
            }
            Map<String, List<Map<String, Object>>> queryResults = queryExecutor.executeAll(database.getDatabasePath(), language);
            Map<String, Integer> rowCounts = new LinkedHashMap<>();
            queryResults.forEach((query, rows) -> rowCounts.put(query, rows.size()));

            if (token.isCancelled()) {
                return cancelled(language);
            }
            GraphEmissionResult graph = graphEmitter.emit(queryResults, source.getBusinessArea(), source.repoName(), clearGraph);

            return LanguageAnalysisResult.builder()
                    .language(language)
                    .status(LanguageAnalysisResult.STATUS_SUCCESS)
                    .databasePath(database.getDatabasePath())
                    .databaseReused(database.isReused())
                    .queryResults(rowCounts)
                    .graph(graph)
                    .build();
        } catch (RuntimeException e) {
            log.error("[code-graph] Analysis failed source={} language={}: {}", sourceId, language, e.getMessage());
            return failed(language, e.getMessage());
        }
    }

    private static LanguageAnalysisResult failed(String language, String error) {
        return LanguageAnalysisResult.builder()
                .language(language)
                .status(LanguageAnalysisResult.STATUS_FAILED)
                .error(error)
                .build();
    }

    private static LanguageAnalysisResult cancelled(String language) {
        return LanguageAnalysisResult.builder()
                .language(language)
                .status(LanguageAnalysisResult.STATUS_CANCELLED)
                .build();
    }
}
