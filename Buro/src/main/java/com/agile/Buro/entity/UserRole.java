package com.agile.Buro.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UserRole {
    ADMIN,
    MANAGER,
    DEVELOPER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("ROLE_")) v = v.substring(5);
        for (UserRole role : values()) {
            if (role.name().equals(v)) return role;
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
