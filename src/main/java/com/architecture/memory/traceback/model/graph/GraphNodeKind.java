package com.architecture.memory.traceback.model.graph;

import java.util.Locale;

/**
 * Node labels written by the graph emitter.
 */
public enum GraphNodeKind {
    FUNCTION("Function"),
    CLASS("Class"),
    FILE("File"),
    SCRIPT("Script"),
    MODULE("Module");

    private final String label;

    GraphNodeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String nodeId(String businessArea, String repo, String entityName) {
        return businessArea + ":" + repo + ":" + name().toLowerCase(Locale.ROOT) + ":" + entityName;
    }
}
