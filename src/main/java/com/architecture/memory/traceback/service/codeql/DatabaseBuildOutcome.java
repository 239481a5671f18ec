package com.architecture.memory.traceback.service.codeql;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Result of {@link CodeQlDatabaseBuilder#buildDatabase}: where the database lives,
 * whether the stored copy was reused, and the source revision it reflects.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseBuildOutcome {

    private Path databasePath;
    private boolean reused;
    private String revision;
}
