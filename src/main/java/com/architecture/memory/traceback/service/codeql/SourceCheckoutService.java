package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.CodeQlBuildException;
import com.architecture.memory.traceback.model.CodeSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Materializes a registered source on local disk so CodeQL can extract it.
 * Filesystem sources are used in place; gitlab sources are shallow-cloned once into the
 * workspace and fast-forwarded on later runs.
 */
@Service
@Slf4j
public class SourceCheckoutService {

    private final CommandRunner commandRunner;
    private final TracebackProperties.CodeQl settings;

    public SourceCheckoutService(CommandRunner commandRunner, TracebackProperties properties) {
        this.commandRunner = commandRunner;
        this.settings = properties.getCodeql();
    }

    public Path checkout(CodeSource source) {
        if (CodeSource.TYPE_FILESYSTEM.equals(source.getSourceType())) {
            Path path = Path.of(source.getPath());
            if (!Files.isDirectory(path)) {
                throw new CodeQlBuildException("Source path does not exist: " + path, null);
            }
            return path;
        }
        if (CodeSource.TYPE_GITLAB.equals(source.getSourceType())) {
            return checkoutGitlab(source);
        }
        throw new CodeQlBuildException("Unsupported source type '" + source.getSourceType() + "' for " + source.getSourceId(), null);
    }

    Path workspaceDirectory(CodeSource source) {
        return settings.getWorkspacePath()
                .resolve(source.getBusinessArea())
                .resolve(LocalCodeQlDatabaseStorage.normalizeRepo(source.getPath()));
    }

    String cloneUrl(CodeSource source) {
        String base = settings.getGitlabUrl().endsWith("/")
                ? settings.getGitlabUrl().substring(0, settings.getGitlabUrl().length() - 1)
                : settings.getGitlabUrl();
        return base + "/" + source.getPath() + ".git";
    }

    private Path checkoutGitlab(CodeSource source) {
        Path target = workspaceDirectory(source);
        if (Files.isDirectory(target.resolve(".git"))) {
            log.info("[checkout] Updating {} in {}", source.getPath(), target);
            commandRunner.run(List.of("git", "pull", "--ff-only"), target, settings.getGitTimeout());
            return target;
        }

        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new CodeQlBuildException("Cannot create workspace for " + source.getPath() + ": " + e.getMessage(), e);
        }
        log.info("[checkout] Cloning {} into {}", source.getPath(), target);
        commandRunner.run(List.of("git", "clone", "--depth", "1", cloneUrl(source), target.toString()), null,
                settings.getGitTimeout());
        return target;
    }
}
