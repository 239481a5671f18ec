package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.exception.CodeQlBuildException;
import com.architecture.memory.traceback.exception.CodeQlCommandException;
import com.architecture.memory.traceback.exception.SourceNotFoundException;
import com.architecture.memory.traceback.model.CodeSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds CodeQL databases and skips the build when the stored database already reflects
 * the source's current revision.
 *
 * <p>Builds of the same (source, language) pair are serialized; distinct pairs build in
 * parallel.
 */
@Service
@Slf4j
public class CodeQlDatabaseBuilder {

    private final CodeQlCli codeQlCli;
    private final CodeQlDatabaseStorage storage;
    private final CodeSourceRegistry registry;
    private final Map<String, ReentrantLock> buildLocks = new ConcurrentHashMap<>();

    public CodeQlDatabaseBuilder(CodeQlCli codeQlCli, CodeQlDatabaseStorage storage, CodeSourceRegistry registry) {
        this.codeQlCli = codeQlCli;
        this.storage = storage;
        this.registry = registry;
    }

    public DatabaseBuildOutcome buildDatabase(String sourceId, String language, Path sourceRoot) {
        return buildDatabase(sourceId, language, sourceRoot, null, false);
    }

    /**
     * @param buildCommand optional build command for compiled languages
     * @param force        rebuild even when the stored database is current
     * @throws CodeQlBuildException when extraction fails or the database cannot be stored
     */
    public DatabaseBuildOutcome buildDatabase(String sourceId, String language, Path sourceRoot,
                                              String buildCommand, boolean force) {
        ReentrantLock lock = lockFor(sourceId, language);
        lock.lock();
        try {
            // re-read under the lock so a build that just finished is seen
            CodeSource source = registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
            String revision = codeQlCli.currentRevision(sourceRoot).orElse(null);

            if (!force && revision != null && revision.equals(source.analyzedCommit(language))) {
                Optional<Path> existing = storage.getDatabasePath(source.getBusinessArea(), source.repoName(), language);
                if (existing.isPresent()) {
                    log.info("[codeql-build] Reusing database for {} language={} at revision {}", sourceId, language, revision);
                    return DatabaseBuildOutcome.builder()
                            .databasePath(existing.get())
                            .reused(true)
                            .revision(revision)
                            .build();
                }
            }

            Path stored = build(source, language, sourceRoot, buildCommand);
            if (revision != null) {
                registry.updateLanguageCommit(sourceId, language, revision);
            }
            return DatabaseBuildOutcome.builder()
                    .databasePath(stored)
                    .reused(false)
                    .revision(revision)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when no stored database exists or the source has moved past the revision it
     * was built from. Unknown revisions always need a rebuild.
     */
    public boolean needsRebuild(String sourceId, String language, Path sourceRoot) {
        CodeSource source = registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
        if (storage.getDatabasePath(source.getBusinessArea(), source.repoName(), language).isEmpty()) {
            return true;
        }
        String revision = codeQlCli.currentRevision(sourceRoot).orElse(null);
        return revision == null || !revision.equals(source.analyzedCommit(language));
    }

    /**
     * Remove the stored database of every language of a source.
     *
     * @return languages whose database was removed
     */
    public List<String> deleteDatabases(String sourceId) {
        CodeSource source = registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
        List<String> removed = new ArrayList<>();
        for (String language : source.getLanguages()) {
            ReentrantLock lock = lockFor(sourceId, language);
            lock.lock();
            try {
                if (storage.delete(source.getBusinessArea(), source.repoName(), language)) {
                    removed.add(language);
                }
            } finally {
                lock.unlock();
            }
        }
        log.info("[codeql-build] Deleted databases of {} languages={}", sourceId, removed);
        return removed;
    }

    private ReentrantLock lockFor(String sourceId, String language) {
        return buildLocks.computeIfAbsent(sourceId + "|" + language, key -> new ReentrantLock());
    }

    private Path build(CodeSource source, String language, Path sourceRoot, String buildCommand) {
        Path tempDirectory;
        try {
            tempDirectory = Files.createTempDirectory("codeql-build-");
        } catch (IOException e) {
            throw new CodeQlBuildException("Cannot create build directory: " + e.getMessage(), e);
        }

        try {
            Path database = tempDirectory.resolve(LocalCodeQlDatabaseStorage.normalizeRepo(source.repoName()) + "_" + language + ".db");
            log.info("[codeql-build] Building database for {} language={}", source.getSourceId(), language);
            codeQlCli.databaseCreate(database, language, sourceRoot, buildCommand);
            return storage.store(database, source.getBusinessArea(), source.repoName(), language);
        } catch (CodeQlCommandException e) {
            throw new CodeQlBuildException("Database creation failed for " + source.getSourceId() + "/" + language
                    + ": " + e.getMessage(), e);
        } finally {
            try {
                LocalCodeQlDatabaseStorage.deleteRecursively(tempDirectory);
            } catch (IOException e) {
                log.warn("[codeql-build] Could not remove {}: {}", tempDirectory, e.getMessage());
            }
        }
    }
}
