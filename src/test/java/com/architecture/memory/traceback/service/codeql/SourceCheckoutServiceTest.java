package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.CodeQlBuildException;
import com.architecture.memory.traceback.model.CodeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SourceCheckoutServiceTest {

    @Mock
    private CommandRunner commandRunner;

    @TempDir
    Path workspace;

    private TracebackProperties properties;
    private SourceCheckoutService service;

    @BeforeEach
    void setUp() {
        properties = new TracebackProperties();
        properties.getCodeql().setWorkspacePath(workspace);
        properties.getCodeql().setGitlabUrl("https://gitlab.example.com/");
        service = new SourceCheckoutService(commandRunner, properties);
    }

    private static CodeSource source(String type, String path) {
        return CodeSource.builder()
                .sourceId("pharmacy_" + type)
                .businessArea("pharmacy")
                .sourceType(type)
                .path(path)
                .build();
    }

    @Test
    void usesFilesystemSourceInPlace() {
        assertThat(service.checkout(source(CodeSource.TYPE_FILESYSTEM, workspace.toString()))).isEqualTo(workspace);
        verifyNoInteractions(commandRunner);
    }

    @Test
    void rejectsMissingFilesystemPath() {
        CodeSource missing = source(CodeSource.TYPE_FILESYSTEM, workspace.resolve("nope").toString());

        assertThatThrownBy(() -> service.checkout(missing))
                .isInstanceOf(CodeQlBuildException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void shallowClonesGitlabSource_onFirstCheckout() {
        CodeSource source = source(CodeSource.TYPE_GITLAB, "team/rx");
        Path target = workspace.resolve("pharmacy").resolve("team_rx");

        assertThat(service.checkout(source)).isEqualTo(target);

        verify(commandRunner).run(List.of("git", "clone", "--depth", "1", "https://gitlab.example.com/team/rx.git",
                target.toString()), null, properties.getCodeql().getGitTimeout());
    }

    @Test
    void fastForwardsExistingClone() throws Exception {
        CodeSource source = source(CodeSource.TYPE_GITLAB, "team/rx");
        Path target = workspace.resolve("pharmacy").resolve("team_rx");
        Files.createDirectories(target.resolve(".git"));

        service.checkout(source);

        verify(commandRunner).run(List.of("git", "pull", "--ff-only"), target, properties.getCodeql().getGitTimeout());
    }

    @Test
    void rejectsUnsupportedSourceType() {
        assertThatThrownBy(() -> service.checkout(source("svn", "team/rx")))
                .isInstanceOf(CodeQlBuildException.class)
                .hasMessageContaining("Unsupported source type");
    }
}
