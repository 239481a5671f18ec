package com.architecture.memory.traceback.service.codeql;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Keeps built CodeQL databases addressable by (business area, repository, language).
 */
public interface CodeQlDatabaseStorage {

    /**
     * Copy a freshly built database into storage, replacing any previous copy.
     *
     * @return the stored database directory
     */
    Path store(Path builtDatabase, String businessArea, String repo, String language);

    Optional<Path> getDatabasePath(String businessArea, String repo, String language);

    List<Path> listDatabases(String businessArea);

    boolean delete(String businessArea, String repo, String language);
}
