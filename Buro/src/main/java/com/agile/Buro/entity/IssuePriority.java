package com.agile.Buro.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssuePriority {
    HIGHEST(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    LOWEST(0);

    // workload weight
    private final int weight;

    IssuePriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssuePriority fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (IssuePriority priority : values()) {
            if (priority.name().equals(v)) return priority;
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
