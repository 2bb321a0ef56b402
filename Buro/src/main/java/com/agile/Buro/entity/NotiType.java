package com.agile.Buro.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotiType {
    ISSUE_ASSIGNED,
    STATUS_CHANGED,
    WELCOME;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
