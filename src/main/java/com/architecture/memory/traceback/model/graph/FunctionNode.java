package com.architecture.memory.traceback.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Property;

/**
 * Read-side view of a function emitted from CodeQL call graph results.
 * Ids follow {@code {area}:{repo}:function:{name}}.
 */
@Node("Function")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionNode {

    @Id
    private String id;

    @Property("name")
    private String name;

    @Property("business_area")
    private String businessArea;

    @Property("repo")
    private String repo;

    @Property("file_path")
    private String filePath;

    @Property("line_start")
    private Integer lineStart;

    @Property("line_end")
    private Integer lineEnd;
}
