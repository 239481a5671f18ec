package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;
import com.architecture.memory.traceback.model.graph.FunctionNode;
import com.architecture.memory.traceback.repository.graph.FunctionNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the CodeQL-derived code graph: nodes whose name or path contains the query,
 * followed by the call, subprocess and import edges around the first matches.
 *
 * <p>Only present when CodeQL analysis is enabled.
 */
@Component
@ConditionalOnProperty(prefix = "traceback.codeql", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class GraphRetriever implements Retriever {

    public static final String NAME = "graph";
    public static final String SOURCE = "code_graph";

    static final int EXPANDED_NODES = 5;
    static final int RELATIONSHIPS_PER_NODE = 3;

    private static final String MATCH_NODES = """
            MATCH (n)
            WHERE n.business_area = $businessArea
              AND (toLower(n.name) CONTAINS toLower($query)
                OR toLower(n.file_path) CONTAINS toLower($query)
                OR toLower(n.path) CONTAINS toLower($query))
            RETURN n, labels(n) AS labels
            LIMIT $limit
            """;

    private static final String NODE_RELATIONSHIPS = """
            MATCH (source {id: $nodeId})-[r:CALLS|RUNS_SUBPROCESS|IMPORTS]->(target)
            WHERE target.business_area = $businessArea
            RETURN source, target, type(r) AS edge_type
            LIMIT $limit
            UNION
            MATCH (source)-[r:CALLS|RUNS_SUBPROCESS|IMPORTS]->(target {id: $nodeId})
            WHERE source.business_area = $businessArea
            RETURN source, target, type(r) AS edge_type
            LIMIT $limit
            """;

    private final Driver neo4jDriver;
    private final FunctionNodeRepository functionNodeRepository;

    @Override
    public String name() {
        return NAME;
    }

    public boolean isAvailable() {
        try {
            neo4jDriver.verifyConnectivity();
            return true;
        } catch (Exception e) {
            log.warn("[retriever:graph] Neo4j not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public RetrievalResult retrieve(String query, String businessArea, int limit, Map<String, Object> filters) {
        if (!isAvailable()) {
            return RetrievalResult.failure(NAME, SOURCE, "Graph retriever not available", "Graph store not available");
        }

        try (Session session = neo4jDriver.session()) {
            List<RetrievedDocument> context = new ArrayList<>(findMatchingNodes(session, query, businessArea, limit));

            List<RetrievedDocument> matches = new ArrayList<>(context);
            for (RetrievedDocument node : matches.subList(0, Math.min(EXPANDED_NODES, matches.size()))) {
                Object nodeId = node.getMetadata().get("node_id");
                if (nodeId != null) {
                    context.addAll(findRelationships(session, nodeId.toString(), businessArea));
                }
            }

            List<RetrievedDocument> documents = deduplicate(context, limit);
            log.info("[retriever:graph] area={} query='{}' documents={}", businessArea, query, documents.size());

            RetrievalResult result = RetrievalResult.of(NAME, SOURCE, documents);
            if (!documents.isEmpty()) {
                result.setMessage("Retrieved " + documents.size() + " graph relationships");
            }
            return result;
        } catch (Exception e) {
            log.error("[retriever:graph] Retrieval failed for area={}: {}", businessArea, e.getMessage());
            return RetrievalResult.failure(NAME, SOURCE, "Graph retrieval failed", e.getMessage());
        }
    }

    public List<FunctionNode> getCallers(String functionName, String businessArea, int limit) {
        return functionNodeRepository.findCallers(functionName, businessArea, limit);
    }

    public List<FunctionNode> getCallees(String functionName, String businessArea, int limit) {
        return functionNodeRepository.findCallees(functionName, businessArea, limit);
    }

    public List<FunctionNode> getScriptCallers(String scriptPath, String businessArea, int limit) {
        return functionNodeRepository.findScriptCallers(scriptPath, businessArea, limit);
    }

    private List<RetrievedDocument> findMatchingNodes(Session session, String query, String businessArea, int limit) {
        Result result = session.run(MATCH_NODES, Map.of(
                "businessArea", businessArea,
                "query", query,
                "limit", limit));

        List<RetrievedDocument> nodes = new ArrayList<>();
        while (result.hasNext()) {
            Record record = result.next();
            Map<String, Object> node = record.get("n").asNode().asMap();
            List<String> labels = record.get("labels").asList(Value::asString);
            String nodeType = labels.isEmpty() ? "Node" : labels.get(0);
            String name = displayName(node);

            Map<String, Object> metadata = new HashMap<>();
            node.forEach((key, value) -> {
                if (!Set.of("id", "name", "path").contains(key)) {
                    metadata.put(key, value);
                }
            });
            metadata.put("node_id", node.get("id"));
            metadata.put("node_type", nodeType);
            metadata.put("business_area", businessArea);

            nodes.add(RetrievedDocument.builder()
                    .title(nodeType + ": " + name)
                    .content(formatNode(node, nodeType))
                    .source(SOURCE)
                    .documentType(SOURCE)
                    .url("")
                    .score(1.0)
                    .metadata(metadata)
                    .build());
        }
        return nodes;
    }

    private List<RetrievedDocument> findRelationships(Session session, String nodeId, String businessArea) {
        Result result = session.run(NODE_RELATIONSHIPS, Map.of(
                "nodeId", nodeId,
                "businessArea", businessArea,
                "limit", RELATIONSHIPS_PER_NODE));

        List<RetrievedDocument> relationships = new ArrayList<>();
        while (result.hasNext() && relationships.size() < RELATIONSHIPS_PER_NODE) {
            Record record = result.next();
            Map<String, Object> source = record.get("source").asNode().asMap();
            Map<String, Object> target = record.get("target").asNode().asMap();
            String edgeType = record.get("edge_type").asString();

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("edge_type", edgeType);
            metadata.put("source_id", source.get("id"));
            metadata.put("target_id", target.get("id"));
            metadata.put("business_area", businessArea);

            relationships.add(RetrievedDocument.builder()
                    .title(edgeType + ": " + displayName(source) + " -> " + displayName(target))
                    .content(edgeType + " relationship: " + displayName(source) + " connects to " + displayName(target))
                    .source(SOURCE)
                    .documentType(SOURCE)
                    .url("")
                    .score(0.9)
                    .metadata(metadata)
                    .build());
        }
        return relationships;
    }

    static List<RetrievedDocument> deduplicate(List<RetrievedDocument> context, int limit) {
        Map<String, RetrievedDocument> unique = new LinkedHashMap<>();
        for (RetrievedDocument document : context) {
            unique.putIfAbsent(document.getTitle() + document.getContent(), document);
            if (unique.size() >= limit) {
                break;
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static String displayName(Map<String, Object> node) {
        Object name = node.get("name");
        if (name == null) {
            name = node.get("path");
        }
        return name == null ? "unknown" : name.toString();
    }

    private static String formatNode(Map<String, Object> node, String nodeType) {
        Set<String> lines = new LinkedHashSet<>();
        lines.add(nodeType + ": " + displayName(node));
        if (node.get("file_path") != null) {
            lines.add("File: " + node.get("file_path"));
        }
        if (node.get("line_start") != null && node.get("line_end") != null) {
            lines.add("Lines: " + node.get("line_start") + "-" + node.get("line_end"));
        }
        if (node.get("repo") != null) {
            lines.add("Repo: " + node.get("repo"));
        }
        return String.join("\n", lines);
    }
}
