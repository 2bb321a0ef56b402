package com.agile.Buro.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kanban columns in workflow order. Any status may move to any other.
 */
public enum IssueStatus {
    BACKLOG,
    TO_DO,
    IN_PROGRESS,
    DONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBefore(IssueStatus other) {
        return ordinal() < other.ordinal();
    }

    @JsonCreator
    public static IssueStatus fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (IssueStatus status : values()) {
            if (status.name().equals(v)) return status;
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}
