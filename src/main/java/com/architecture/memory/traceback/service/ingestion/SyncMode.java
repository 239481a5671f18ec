package com.architecture.memory.traceback.service.ingestion;

public enum SyncMode {
    FULL,
    INCREMENTAL
}
