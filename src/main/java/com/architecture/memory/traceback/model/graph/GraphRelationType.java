package com.architecture.memory.traceback.model.graph;

public enum GraphRelationType {
    CALLS,
    RUNS_SUBPROCESS,
    IMPORTS,
    DEFINES
}
