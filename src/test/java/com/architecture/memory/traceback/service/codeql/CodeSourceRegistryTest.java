package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.SourceNotFoundException;
import com.architecture.memory.traceback.model.CodeSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeSourceRegistryTest {

    @TempDir
    Path tempDir;

    private static SourceConfigResolver resolver(String sourcesConfig) {
        TracebackProperties properties = new TracebackProperties();
        properties.setBusinessAreas(List.of("pharmacy", "supply_chain"));
        properties.setSourcesConfig(sourcesConfig);
        return new SourceConfigResolver(properties);
    }

    private CodeSourceRegistry registry(boolean codeqlEnabled, String sourcesConfig) {
        return new CodeSourceRegistry(tempDir.resolve("registry.json"), codeqlEnabled, resolver(sourcesConfig));
    }

    @Test
    void derivesSourceIdFromAreaTypeAndPath() {
        assertThat(CodeSourceRegistry.sourceIdOf("pharmacy", "gitlab", "team/rx-service"))
                .isEqualTo("pharmacy_gitlab_team_rx-service");
    }

    @Test
    void survivesRestart_withRevisionState() {
        CodeSourceRegistry registry = registry(true, "");
        String id = registry.register("pharmacy", "gitlab", "team/rx", List.of("python", "java"));
        registry.updateLanguageCommit(id, "python", "abc123");

        CodeSourceRegistry reloaded = registry(true, "");

        CodeSource source = reloaded.get(id).orElseThrow();
        assertThat(source.getName()).isEqualTo("team/rx");
        assertThat(source.getLanguages()).containsExactly("python", "java");
        assertThat(source.getLastAnalyzedCommit()).isEqualTo("abc123");
        assertThat(source.getLastAnalyzedTime()).isNotNull();
        assertThat(source.analyzedCommit("python")).isEqualTo("abc123");
        assertThat(source.analyzedCommit("java")).isNull();
    }

    @Test
    void updateCommitHash_marksEveryLanguageAsBuiltFromTheRevision() {
        CodeSourceRegistry registry = registry(true, "");
        String id = registry.register("pharmacy", "gitlab", "team/rx", List.of("python", "java"));
        registry.updateLanguageCommit(id, "python", "abc123");

        registry.updateCommitHash(id, "def456");

        CodeSource source = registry(true, "").get(id).orElseThrow();
        assertThat(source.getLastAnalyzedCommit()).isEqualTo("def456");
        assertThat(source.analyzedCommit("python")).isEqualTo("def456");
        assertThat(source.analyzedCommit("java")).isEqualTo("def456");
    }

    @Test
    void overwritesExistingRegistration() {
        CodeSourceRegistry registry = registry(true, "");
        String id = registry.register("pharmacy", "gitlab", "team/rx", List.of("python"));
        registry.updateCommitHash(id, "abc123");

        String again = registry.register("pharmacy", "gitlab", "team/rx", List.of("java"), "Rx", null, false, Map.of());

        assertThat(again).isEqualTo(id);
        CodeSource source = registry.get(id).orElseThrow();
        assertThat(source.getLanguages()).containsExactly("java");
        assertThat(source.getName()).isEqualTo("Rx");
        assertThat(source.isEnabled()).isFalse();
        assertThat(source.getLastAnalyzedCommit()).isNull();
    }

    @Test
    void returnsCopies_soCallersCannotMutateTheCatalog() {
        CodeSourceRegistry registry = registry(true, "");
        String id = registry.register("pharmacy", "filesystem", "/srv/rx", List.of("python"));

        registry.get(id).orElseThrow().setEnabled(false);

        assertThat(registry.get(id).orElseThrow().isEnabled()).isTrue();
    }

    @Test
    void filtersListing_byAreaTypeAndEnabledFlag() {
        CodeSourceRegistry registry = registry(true, "");
        registry.register("pharmacy", "gitlab", "team/rx", List.of("python"));
        registry.register("pharmacy", "filesystem", "/srv/rx", List.of("python"), null, null, false, Map.of());
        registry.register("supply_chain", "gitlab", "team/wms", List.of("java"));

        assertThat(registry.listSources("pharmacy", null, false)).hasSize(2);
        assertThat(registry.listSources("pharmacy", null, true)).extracting(CodeSource::getPath)
                .containsExactly("team/rx");
        assertThat(registry.listSources(null, "gitlab", false)).extracting(CodeSource::getBusinessArea)
                .containsExactly("pharmacy", "supply_chain");
    }

    @Test
    void rejectsUpdatesAndDeletes_forUnknownSource() {
        CodeSourceRegistry registry = registry(true, "");

        assertThatThrownBy(() -> registry.updateCommitHash("missing", "abc"))
                .isInstanceOf(SourceNotFoundException.class)
                .hasMessage("Source not found: missing");
        assertThatThrownBy(() -> registry.delete("missing")).isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void deletesPersistently() {
        CodeSourceRegistry registry = registry(true, "");
        String id = registry.register("pharmacy", "gitlab", "team/rx", List.of("python"));

        registry.delete(id);

        assertThat(registry(true, "").get(id)).isEmpty();
    }

    @Test
    void startsEmpty_whenRegistryFileIsCorrupt() throws Exception {
        Files.writeString(tempDir.resolve("registry.json"), "{not json");

        CodeSourceRegistry registry = registry(true, "");

        assertThat(registry.listSources(null, null, false)).isEmpty();
    }

    @Test
    void enablesCodeQl_onlyWithGlobalSwitchAndAreaBlock() {
        String config = "pharmacy:codeql(repos=team/rx);supply_chain:codeql(repos=team/wms,enabled=false)";

        CodeSourceRegistry enabled = registry(true, config);
        assertThat(enabled.isCodeQlEnabled("pharmacy")).isTrue();
        assertThat(enabled.isCodeQlEnabled("supply_chain")).isFalse();
        assertThat(enabled.isCodeQlEnabled("unknown")).isFalse();

        assertThat(registry(false, config).isCodeQlEnabled("pharmacy")).isFalse();
    }

    @Test
    void treatsEmptyCodeQlBlockAsDisabled() {
        assertThat(registry(true, "pharmacy:codeql").isCodeQlEnabled("pharmacy")).isFalse();
    }
}
