package com.architecture.memory.traceback.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    CONFLUENCE,
    FIRESTORE,
    GITLAB,
    CODE,
    OPENMETADATA,
    CODEQL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        return SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
