package com.architecture.memory.traceback.repository.graph;

import com.architecture.memory.traceback.model.graph.FunctionNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FunctionNodeRepository extends Neo4jRepository<FunctionNode, String> {

    @Query("MATCH (caller:Function)-[:CALLS]->(callee:Function {name: $functionName}) " +
           "WHERE caller.business_area = $businessArea AND callee.business_area = $businessArea " +
           "RETURN DISTINCT caller LIMIT $limit")
    List<FunctionNode> findCallers(String functionName, String businessArea, int limit);

    @Query("MATCH (caller:Function {name: $functionName})-[:CALLS]->(callee:Function) " +
           "WHERE caller.business_area = $businessArea AND callee.business_area = $businessArea " +
           "RETURN DISTINCT callee LIMIT $limit")
    List<FunctionNode> findCallees(String functionName, String businessArea, int limit);

    // Functions that launch the script through subprocess calls
    @Query("MATCH (caller:Function)-[:RUNS_SUBPROCESS]->(script:Script) " +
           "WHERE script.business_area = $businessArea " +
           "AND (script.name = $scriptPath OR script.path = $scriptPath OR script.name ENDS WITH $scriptPath) " +
           "RETURN DISTINCT caller LIMIT $limit")
    List<FunctionNode> findScriptCallers(String scriptPath, String businessArea, int limit);
}
