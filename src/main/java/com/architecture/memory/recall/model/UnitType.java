package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of retrieval unit. The label is the value stored in the {@code type} payload field.
 */
public enum UnitType {
    FUNCTION("Function"),
    ASYNC_FUNCTION("AsyncFunction"),
    CLASS("Class"),
    FILE_CHUNK("FileChunk"),
    /**
     * Artifact units whose type is missing or not one of the above.
     */
    UNKNOWN("Unknown");

    private final String label;

    UnitType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static UnitType fromLabel(String label) {
        for (UnitType type : values()) {
            if (type.label.equals(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Payload label of {@code type}, {@code Unknown} when absent.
     */
    public static String labelOf(UnitType type) {
        return type == null ? UNKNOWN.label : type.label;
    }

    public boolean isSyntactic() {
        return this != FILE_CHUNK;
    }
}
