package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.dto.AreaAnalysisResult;
import com.architecture.memory.traceback.dto.GraphEmissionResult;
import com.architecture.memory.traceback.dto.LanguageAnalysisResult;
import com.architecture.memory.traceback.dto.SourceAnalysisResult;
import com.architecture.memory.traceback.exception.CodeQlBuildException;
import com.architecture.memory.traceback.model.CodeSource;
import com.architecture.memory.traceback.service.graph.GraphEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodeGraphAnalysisServiceTest {

    private static final String SOURCE_ID = "pharmacy_gitlab_team_rx";
    private static final Path ROOT = Path.of("/workspace/pharmacy/team_rx");
    private static final Path PYTHON_DB = Path.of("/data/pharmacy/team_rx/python/team_rx_python.db");
    private static final Path JAVA_DB = Path.of("/data/pharmacy/team_rx/java/team_rx_java.db");

    @Mock
    private CodeSourceRegistry registry;

    @Mock
    private SourceCheckoutService checkoutService;

    @Mock
    private CodeQlDatabaseBuilder databaseBuilder;

    @Mock
    private CodeQlQueryExecutor queryExecutor;

    @Mock
    private GraphEmitter graphEmitter;

    private CodeGraphAnalysisService service;

    @BeforeEach
    void setUp() {
        service = service("pharmacy:codeql(enabled=true,repos=team/rx|team/billing)");
    }

    private CodeGraphAnalysisService service(String sourcesConfig) {
        TracebackProperties properties = new TracebackProperties();
        properties.setBusinessAreas(List.of("pharmacy", "supply_chain"));
        properties.setSourcesConfig(sourcesConfig);
        return new CodeGraphAnalysisService(registry, new SourceConfigResolver(properties), checkoutService,
                databaseBuilder, queryExecutor, graphEmitter);
    }

    private static CodeSource source(boolean enabled) {
        return CodeSource.builder()
                .sourceId(SOURCE_ID)
                .businessArea("pharmacy")
                .sourceType(CodeSource.TYPE_GITLAB)
                .path("team/rx")
                .languages(List.of("python", "java"))
                .enabled(enabled)
                .build();
    }

    private static DatabaseBuildOutcome built(Path database) {
        return DatabaseBuildOutcome.builder().databasePath(database).revision("abc123").build();
    }

    private static GraphEmissionResult graph(int nodes, int edges) {
        return GraphEmissionResult.builder().nodes(nodes).edges(edges).build();
    }

    private void givenEnabledSource() {
        when(registry.get(SOURCE_ID)).thenReturn(Optional.of(source(true)));
        when(registry.isCodeQlEnabled("pharmacy")).thenReturn(true);
        when(checkoutService.checkout(any(CodeSource.class))).thenReturn(ROOT);
    }

    @Test
    void skipsAnalysis_whenAreaHasNoCodeQl() {
        when(registry.get(SOURCE_ID)).thenReturn(Optional.of(source(true)));
        when(registry.isCodeQlEnabled("pharmacy")).thenReturn(false);

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID);

        assertThat(result.getStatus()).isEqualTo("skipped");
        assertThat(result.getReason()).isEqualTo("codeql_not_enabled_for_business_area");
        verifyNoInteractions(checkoutService, databaseBuilder, queryExecutor, graphEmitter);
        verify(registry, never()).updateLanguageCommit(anyString(), anyString(), anyString());
    }

    @Test
    void skipsDisabledSource() {
        when(registry.get(SOURCE_ID)).thenReturn(Optional.of(source(false)));

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID);

        assertThat(result.getReason()).isEqualTo("source_disabled");
        verifyNoInteractions(checkoutService);
    }

    @Test
    void reportsUnknownSource() {
        when(registry.get("missing")).thenReturn(Optional.empty());

        SourceAnalysisResult result = service.analyzeSource("missing");

        assertThat(result.getStatus()).isEqualTo("error");
        assertThat(result.getError()).isEqualTo("Source not found: missing");
    }

    @Test
    void clearsGraphOnlyBeforeFirstEmission() {
        givenEnabledSource();
        Map<String, List<Map<String, Object>>> pythonRows = Map.of("call_graph", List.of(Map.of("#1", "a", "#2", "b")));
        when(databaseBuilder.buildDatabase(SOURCE_ID, "python", ROOT)).thenReturn(built(PYTHON_DB));
        when(databaseBuilder.buildDatabase(SOURCE_ID, "java", ROOT)).thenReturn(built(JAVA_DB));
        when(queryExecutor.executeAll(PYTHON_DB, "python")).thenReturn(pythonRows);
        when(queryExecutor.executeAll(JAVA_DB, "java")).thenReturn(Map.of("classes", List.of()));
        when(graphEmitter.emit(pythonRows, "pharmacy", "team/rx", true)).thenReturn(graph(2, 1));
        when(graphEmitter.emit(Map.of("classes", List.of()), "pharmacy", "team/rx", false)).thenReturn(graph(0, 0));

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID);

        assertThat(result.getStatus()).isEqualTo("success");
        LanguageAnalysisResult python = result.getLanguages().get("python");
        assertThat(python.getStatus()).isEqualTo("success");
        assertThat(python.getQueryResults()).containsEntry("call_graph", 1);
        assertThat(python.getGraph().getNodes()).isEqualTo(2);
        assertThat(result.getLanguages().get("java").getStatus()).isEqualTo("success");
    }

    @Test
    void isolatesLanguageFailure() {
        givenEnabledSource();
        when(databaseBuilder.buildDatabase(SOURCE_ID, "python", ROOT))
                .thenThrow(new CodeQlBuildException("Database creation failed for rx/python", null));
        when(databaseBuilder.buildDatabase(SOURCE_ID, "java", ROOT)).thenReturn(built(JAVA_DB));
        when(queryExecutor.executeAll(JAVA_DB, "java")).thenReturn(Map.of());
        when(graphEmitter.emit(Map.of(), "pharmacy", "team/rx", true)).thenReturn(graph(0, 0));

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID);

        assertThat(result.getStatus()).isEqualTo("success");
        assertThat(result.getLanguages().get("python").getStatus()).isEqualTo("failed");
        assertThat(result.getLanguages().get("python").getError()).contains("rx/python");
        assertThat(result.getLanguages().get("java").getStatus()).isEqualTo("success");
    }

    @Test
    void marksEveryLanguageFailed_whenCheckoutFails() {
        when(registry.get(SOURCE_ID)).thenReturn(Optional.of(source(true)));
        when(registry.isCodeQlEnabled("pharmacy")).thenReturn(true);
        when(checkoutService.checkout(any(CodeSource.class)))
                .thenThrow(new CodeQlBuildException("Source path does not exist: /srv/rx", null));

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID);

        assertThat(result.getLanguages()).hasSize(2);
        assertThat(result.getLanguages().values()).allSatisfy(language -> {
            assertThat(language.getStatus()).isEqualTo("failed");
            assertThat(language.getError()).startsWith("Checkout failed");
        });
        verifyNoInteractions(databaseBuilder);
    }

    @Test
    void stopsBeforeEmitting_whenCancelledDuringBuild() {
        givenEnabledSource();
        AnalysisCancellationToken token = new AnalysisCancellationToken();
        when(databaseBuilder.buildDatabase(SOURCE_ID, "python", ROOT)).thenAnswer(invocation -> {
            token.cancel();
            return built(PYTHON_DB);
        });

        SourceAnalysisResult result = service.analyzeSource(SOURCE_ID, token);

        assertThat(result.getLanguages().get("python").getStatus()).isEqualTo("cancelled");
        assertThat(result.getLanguages().get("java").getStatus()).isEqualTo("cancelled");
        verifyNoInteractions(queryExecutor, graphEmitter);
    }

    @Test
    void reportsNothingToCancel_whenNoAnalysisRuns() {
        assertThat(service.cancelAnalysis(SOURCE_ID)).isFalse();
    }

    @Test
    void skipsArea_withoutRegisteredSources() {
        when(registry.isCodeQlEnabled("pharmacy")).thenReturn(true);
        when(registry.listSources("pharmacy", null, true)).thenReturn(List.of());

        AreaAnalysisResult result = service.analyzeBusinessArea("pharmacy");

        assertThat(result.getStatus()).isEqualTo("skipped");
        assertThat(result.getReason()).isEqualTo("no_sources_registered");
    }

    @Test
    void analyzesEveryEnabledSourceOfArea() {
        givenEnabledSource();
        when(registry.listSources("pharmacy", null, true)).thenReturn(List.of(source(true)));
        when(databaseBuilder.buildDatabase(eq(SOURCE_ID), anyString(), eq(ROOT)))
                .thenThrow(new CodeQlBuildException("boom", null));

        AreaAnalysisResult result = service.analyzeBusinessArea("pharmacy");

        assertThat(result.getStatus()).isEqualTo("success");
        assertThat(result.getSources()).containsOnlyKeys(SOURCE_ID);
    }

    @Test
    void registersConfiguredRepos_andKeepsExistingOnes() {
        String existing = "pharmacy_gitlab_team_rx";
        String added = "pharmacy_gitlab_team_billing";
        when(registry.get(existing)).thenReturn(Optional.of(source(true)));
        when(registry.get(added)).thenReturn(Optional.empty());
        when(registry.register("pharmacy", "gitlab", "team/billing", List.of("python", "java"),
                "pharmacy - team/billing", added, true, Map.of())).thenReturn(added);

        Map<String, List<String>> registered = service.syncRegisteredSourcesFromConfig();

        assertThat(registered).containsOnlyKeys("pharmacy");
        assertThat(registered.get("pharmacy")).containsExactly(existing, added);
        verify(registry, never()).register(eq("pharmacy"), eq("gitlab"), eq("team/rx"), anyList(),
                anyString(), anyString(), anyBoolean(), anyMap());
    }

    @Test
    void registersNothing_whenCodeQlBlockIsDisabledOrEmpty() {
        CodeGraphAnalysisService disabled = service("pharmacy:codeql(enabled=false,repos=team/rx);supply_chain:codeql(enabled=true)");

        Map<String, List<String>> registered = disabled.syncRegisteredSourcesFromConfig();

        assertThat(registered.get("pharmacy")).isEmpty();
        assertThat(registered.get("supply_chain")).isEmpty();
        verifyNoInteractions(registry);
    }

    @Test
    void removeSource_dropsDatabasesBeforeUnregistering() {
        when(databaseBuilder.deleteDatabases(SOURCE_ID)).thenReturn(List.of("python"));

        service.removeSource(SOURCE_ID);

        InOrder inOrder = inOrder(databaseBuilder, registry);
        inOrder.verify(databaseBuilder).deleteDatabases(SOURCE_ID);
        inOrder.verify(registry).delete(SOURCE_ID);
        verifyNoInteractions(graphEmitter);
    }
}
