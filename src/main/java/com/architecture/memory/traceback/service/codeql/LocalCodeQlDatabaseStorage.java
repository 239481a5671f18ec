package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.CodeQlBuildException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem layout {@code {root}/{area}/{normalized repo}/{language}/{name}.db}.
 */
@Component
@Slf4j
public class LocalCodeQlDatabaseStorage implements CodeQlDatabaseStorage {

    static final String DATABASE_MARKER = "codeql-database.yml";

    private final Path root;

    public LocalCodeQlDatabaseStorage(TracebackProperties properties) {
        this(properties.getCodeql().getDatabasePath());
    }

    LocalCodeQlDatabaseStorage(Path root) {
        this.root = root;
    }

    public static String normalizeRepo(String repo) {
        return repo.replace('/', '_').replace('\\', '_').replace(':', '_');
    }

    Path languageDirectory(String businessArea, String repo, String language) {
        return root.resolve(businessArea).resolve(normalizeRepo(repo)).resolve(language);
    }

    @Override
    public Path store(Path builtDatabase, String businessArea, String repo, String language) {
        Path target = languageDirectory(businessArea, repo, language);
        Path stored = target.resolve(builtDatabase.getFileName().toString());
        try {
            deleteRecursively(target);
            Files.createDirectories(target);
            copyRecursively(builtDatabase, stored);
        } catch (IOException | UncheckedIOException e) {
            throw new CodeQlBuildException("Failed to store database for " + repo + "/" + language + ": " + e.getMessage(), e);
        }
        log.info("[codeql-storage] Stored database area={} repo={} language={} at {}", businessArea, repo, language, stored);
        return stored;
    }

    @Override
    public Optional<Path> getDatabasePath(String businessArea, String repo, String language) {
        Path directory = languageDirectory(businessArea, repo, language);
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> children = Files.list(directory)) {
            Optional<Path> database = children
                    .filter(Files::isDirectory)
                    .filter(child -> {
                        String name = child.getFileName().toString();
                        return name.endsWith(".db") || name.contains("codeql");
                    })
                    .sorted()
                    .findFirst();
            if (database.isPresent()) {
                return database;
            }
        } catch (IOException e) {
            log.warn("[codeql-storage] Could not list {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
        return Files.exists(directory.resolve(DATABASE_MARKER)) ? Optional.of(directory) : Optional.empty();
    }

    @Override
    public List<Path> listDatabases(String businessArea) {
        Path areaDirectory = root.resolve(businessArea);
        if (!Files.isDirectory(areaDirectory)) {
            return List.of();
        }
        List<Path> databases = new ArrayList<>();
        try (Stream<Path> repos = Files.list(areaDirectory)) {
            for (Path repo : repos.filter(Files::isDirectory).sorted().collect(Collectors.toList())) {
                try (Stream<Path> languages = Files.list(repo)) {
                    for (Path language : languages.filter(Files::isDirectory).sorted().collect(Collectors.toList())) {
                        getDatabasePath(businessArea, repo.getFileName().toString(), language.getFileName().toString())
                                .ifPresent(databases::add);
                    }
                }
            }
        } catch (IOException e) {
            log.warn("[codeql-storage] Could not list databases of area={}: {}", businessArea, e.getMessage());
        }
        return databases;
    }

    @Override
    public boolean delete(String businessArea, String repo, String language) {
        Path directory = languageDirectory(businessArea, repo, language);
        if (!Files.exists(directory)) {
            return false;
        }
        try {
            deleteRecursively(directory);
            log.info("[codeql-storage] Deleted database area={} repo={} language={}", businessArea, repo, language);
            return true;
        } catch (IOException e) {
            log.error("[codeql-storage] Failed to delete {}: {}", directory, e.getMessage());
            return false;
        }
    }

    private static void copyRecursively(Path source, Path target) throws IOException {
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path path : paths.collect(Collectors.toList())) {
                Path destination = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
    }
}
