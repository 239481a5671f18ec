package com.architecture.memory.traceback.service.graph;

import com.architecture.memory.traceback.model.graph.GraphNodeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Creates a uniqueness constraint on {@code id} for every code graph label at start-up.
 * An unreachable graph store is logged and does not stop the application.
 */
@Component
@ConditionalOnProperty(prefix = "traceback.codeql", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class GraphSchemaInitializer implements CommandLineRunner {

    private final Driver neo4jDriver;

    @Override
    public void run(String... args) {
        log.info("[graph-schema] Ensuring node constraints...");
        try (Session session = neo4jDriver.session()) {
            for (GraphNodeKind kind : GraphNodeKind.values()) {
                session.run(constraintFor(kind)).consume();
            }
            log.info("[graph-schema] Constraints ready for {} labels", GraphNodeKind.values().length);
        } catch (Exception e) {
            log.error("[graph-schema] Could not create constraints: {}", e.getMessage());
        }
    }

    static String constraintFor(GraphNodeKind kind) {
        return "CREATE CONSTRAINT " + kind.name().toLowerCase(Locale.ROOT) + "_id IF NOT EXISTS "
                + "FOR (n:" + kind.label() + ") REQUIRE n.id IS UNIQUE";
    }
}
