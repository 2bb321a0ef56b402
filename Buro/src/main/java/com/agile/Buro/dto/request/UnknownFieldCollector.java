package com.agile.Buro.dto.request;

import com.agile.Buro.exception.InvalidInputException;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for partial-update bodies: remembers every JSON field without a setter so it
 * can be rejected instead of silently dropped.
 */
public abstract class UnknownFieldCollector {

    private final List<String> unknownFields = new ArrayList<>();

    @JsonAnySetter
    public void unknownField(String name, Object ignored) {
        unknownFields.add(name);
    }

    protected void rejectUnknownFields() {
        if (!unknownFields.isEmpty()) {
            throw new InvalidInputException("Unknown field(s): " + String.join(", ", unknownFields));
        }
    }
}
