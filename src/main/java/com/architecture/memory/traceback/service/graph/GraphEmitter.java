package com.architecture.memory.traceback.service.graph;

import com.architecture.memory.traceback.dto.GraphEmissionResult;
import com.architecture.memory.traceback.exception.ExternalServiceUnavailableException;
import com.architecture.memory.traceback.model.graph.GraphNodeKind;
import com.architecture.memory.traceback.model.graph.GraphRelationType;
import com.architecture.memory.traceback.service.codeql.CodeQlQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns CodeQL query rows into graph nodes and edges and writes them to Neo4j.
 *
 * <p>Everything written is tagged with {@code business_area} and {@code repo}; that pair is
 * the scope of {@link #deleteRepoGraph}. Nodes and edges are MERGEd so re-emitting the same
 * rows is idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphEmitter {

    static final String DELETE_REPO_GRAPH = """
            MATCH (n)
            WHERE n.business_area = $businessArea AND n.repo = $repo
            DETACH DELETE n
            """;

    private static final String MERGE_NODES = """
            UNWIND $rows AS row
            MERGE (n:%s {id: row.id})
            ON CREATE SET n += row.properties, n.business_area = $businessArea, n.repo = $repo
            ON MATCH SET n += row.properties
            """;

    private static final String MERGE_EDGES = """
            UNWIND $rows AS row
            MATCH (source:%s {id: row.source}), (target:%s {id: row.target})
            MERGE (source)-[r:%s]->(target)
            ON CREATE SET r.business_area = $businessArea, r.repo = $repo
            """;

    private final Driver neo4jDriver;

    public void deleteRepoGraph(String businessArea, String repo) {
        try (Session session = neo4jDriver.session()) {
            session.run(DELETE_REPO_GRAPH, Map.of("businessArea", businessArea, "repo", repo)).consume();
            log.info("[graph-emitter] Deleted graph area={} repo={}", businessArea, repo);
        } catch (Neo4jException e) {
            throw new ExternalServiceUnavailableException("neo4j", "failed to delete graph of " + repo + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replace the (area, repo) graph with the one described by {@code queryResults}.
     */
    public GraphEmissionResult emit(Map<String, List<Map<String, Object>>> queryResults, String businessArea, String repo) {
        return emit(queryResults, businessArea, repo, true);
    }

    /**
     * @param replaceExisting delete the (area, repo) graph before writing
     */
    public GraphEmissionResult emit(Map<String, List<Map<String, Object>>> queryResults, String businessArea, String repo,
                                    boolean replaceExisting) {
        GraphBatch batch = new GraphBatch(businessArea, repo);
        queryResults.forEach((query, rows) -> {
            switch (query) {
                case CodeQlQueryExecutor.CALL_GRAPH -> rows.forEach(batch::addCall);
                case CodeQlQueryExecutor.SUBPROCESS_CALLS -> rows.forEach(batch::addSubprocessCall);
                case CodeQlQueryExecutor.IMPORTS -> rows.forEach(batch::addImport);
                case CodeQlQueryExecutor.CLASSES -> rows.forEach(batch::addClass);
                default -> log.debug("[graph-emitter] Ignoring results of unknown query {}", query);
            }
        });

        if (replaceExisting) {
            deleteRepoGraph(businessArea, repo);
        }

        try (Session session = neo4jDriver.session()) {
            for (Map.Entry<GraphNodeKind, Map<String, Map<String, Object>>> entry : batch.nodes.entrySet()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                entry.getValue().forEach((id, properties) -> rows.add(Map.of("id", id, "properties", properties)));
                session.run(MERGE_NODES.formatted(entry.getKey().label()), params(rows, businessArea, repo)).consume();
            }
            for (Map.Entry<String, Set<EdgeSpec>> entry : batch.edges.entrySet()) {
                EdgeSpec first = entry.getValue().iterator().next();
                List<Map<String, Object>> rows = new ArrayList<>();
                entry.getValue().forEach(edge -> rows.add(Map.of("source", edge.sourceId, "target", edge.targetId)));
                session.run(MERGE_EDGES.formatted(first.sourceKind.label(), first.targetKind.label(), first.type.name()),
                        params(rows, businessArea, repo)).consume();
            }
        } catch (Neo4jException e) {
            throw new ExternalServiceUnavailableException("neo4j", "failed to write graph of " + repo + ": " + e.getMessage(), e);
        }

        GraphEmissionResult result = GraphEmissionResult.builder()
                .nodes(batch.nodeCount())
                .edges(batch.edgeCount())
                .build();
        log.info("[graph-emitter] Emitted graph area={} repo={} nodes={} edges={}",
                businessArea, repo, result.getNodes(), result.getEdges());
        return result;
    }

    private static Map<String, Object> params(List<Map<String, Object>> rows, String businessArea, String repo) {
        Map<String, Object> params = new HashMap<>();
        params.put("rows", rows);
        params.put("businessArea", businessArea);
        params.put("repo", repo);
        return params;
    }

    /**
     * Nodes and edges collected from one emission, deduplicated by id.
     */
    static final class GraphBatch {

        private final String businessArea;
        private final String repo;
        private final Map<GraphNodeKind, Map<String, Map<String, Object>>> nodes = new EnumMap<>(GraphNodeKind.class);
        private final Map<String, Set<EdgeSpec>> edges = new LinkedHashMap<>();

        GraphBatch(String businessArea, String repo) {
            this.businessArea = businessArea;
            this.repo = repo;
        }

        // caller, callee, caller file/start/end, callee file/start/end
        void addCall(Map<String, Object> row) {
            String caller = text(row, "#1");
            String callee = text(row, "#2");
            if (caller == null || callee == null) {
                return;
            }
            String callerId = function(caller, text(row, "#3"), number(row, "#4"), number(row, "#5"));
            String calleeId = function(callee, text(row, "#6"), number(row, "#7"), number(row, "#8"));
            edge(GraphRelationType.CALLS, GraphNodeKind.FUNCTION, callerId, GraphNodeKind.FUNCTION, calleeId);
        }

        // function, script, file, start, end
        void addSubprocessCall(Map<String, Object> row) {
            String function = text(row, "#1");
            String script = text(row, "#2");
            if (function == null || script == null) {
                return;
            }
            String functionId = function(function, text(row, "#3"), number(row, "#4"), number(row, "#5"));
            Map<String, Object> properties = new HashMap<>();
            properties.put("name", script);
            properties.put("path", script);
            String scriptId = node(GraphNodeKind.SCRIPT, script, properties);
            edge(GraphRelationType.RUNS_SUBPROCESS, GraphNodeKind.FUNCTION, functionId, GraphNodeKind.SCRIPT, scriptId);
        }

        // file, module
        void addImport(Map<String, Object> row) {
            String file = text(row, "#1");
            String module = text(row, "#2");
            if (file == null || module == null) {
                return;
            }
            String fileId = file(file);
            String moduleId = node(GraphNodeKind.MODULE, module, new HashMap<>(Map.of("name", module)));
            edge(GraphRelationType.IMPORTS, GraphNodeKind.FILE, fileId, GraphNodeKind.MODULE, moduleId);
        }

        // file, class, start, end
        void addClass(Map<String, Object> row) {
            String file = text(row, "#1");
            String className = text(row, "#2");
            if (file == null || className == null) {
                return;
            }
            String fileId = file(file);
            Map<String, Object> properties = new HashMap<>();
            properties.put("name", className);
            properties.put("file_path", file);
            properties.put("line_start", number(row, "#3"));
            properties.put("line_end", number(row, "#4"));
            String classId = node(GraphNodeKind.CLASS, className, properties);
            edge(GraphRelationType.DEFINES, GraphNodeKind.FILE, fileId, GraphNodeKind.CLASS, classId);
        }

        int nodeCount() {
            return nodes.values().stream().mapToInt(Map::size).sum();
        }

        int edgeCount() {
            return edges.values().stream().mapToInt(Set::size).sum();
        }

        private String function(String name, String filePath, long lineStart, long lineEnd) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("name", name);
            properties.put("file_path", filePath == null ? "" : filePath);
            properties.put("line_start", lineStart);
            properties.put("line_end", lineEnd);
            return node(GraphNodeKind.FUNCTION, name, properties);
        }

        private String file(String path) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("name", path);
            properties.put("file_path", path);
            return node(GraphNodeKind.FILE, path, properties);
        }

        private String node(GraphNodeKind kind, String entityName, Map<String, Object> properties) {
            String id = kind.nodeId(businessArea, repo, entityName);
            // the last row mentioning a node decides its properties
            nodes.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(id, properties);
            return id;
        }

        private void edge(GraphRelationType type, GraphNodeKind sourceKind, String sourceId,
                          GraphNodeKind targetKind, String targetId) {
            edges.computeIfAbsent(type.name() + ":" + sourceKind.name() + ":" + targetKind.name(), k -> new LinkedHashSet<>())
                    .add(new EdgeSpec(type, sourceKind, sourceId, targetKind, targetId));
        }

        private static String text(Map<String, Object> row, String column) {
            Object value = row.get(column);
            if (value == null) {
                return null;
            }
            String text = value.toString();
            return text.isBlank() ? null : text;
        }

        private static long number(Map<String, Object> row, String column) {
            Object value = row.get(column);
            if (value instanceof Number number) {
                return number.longValue();
            }
            if (value != null) {
                try {
                    return Long.parseLong(value.toString());
                } catch (NumberFormatException e) {
                    return 0L;
                }
            }
            return 0L;
        }
    }

    static final class EdgeSpec {

        private final GraphRelationType type;
        private final GraphNodeKind sourceKind;
        private final String sourceId;
        private final GraphNodeKind targetKind;
        private final String targetId;

        EdgeSpec(GraphRelationType type, GraphNodeKind sourceKind, String sourceId, GraphNodeKind targetKind, String targetId) {
            this.type = type;
            this.sourceKind = sourceKind;
            this.sourceId = sourceId;
            this.targetKind = targetKind;
            this.targetId = targetId;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof EdgeSpec edge)) {
                return false;
            }
            return type == edge.type && sourceId.equals(edge.sourceId) && targetId.equals(edge.targetId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, sourceId, targetId);
        }
    }
}
