package com.architecture.memory.traceback.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DocumentType {
    REQUIREMENT,
    CONFIG,
    CODE,
    ISSUE,
    WIKI,
    LINEAGE,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DocumentType fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        try {
            return DocumentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
