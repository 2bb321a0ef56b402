package com.agile.Buro.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueType {
    BUG,
    TASK,
    STORY,
    EPIC;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueType fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (IssueType type : values()) {
            if (type.name().equals(v)) return type;
        }
        throw new IllegalArgumentException("Unknown issue type: " + value);
    }
}
