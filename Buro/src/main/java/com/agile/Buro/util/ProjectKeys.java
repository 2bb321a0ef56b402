package com.agile.Buro.util;

import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.exception.InvalidInputException;

import java.util.Locale;

public final class ProjectKeys {

    private ProjectKeys() {}

    /**
     * Trims and upper-cases a project key, rejecting anything that is not 1 to 10
     * ASCII letters or digits.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new InvalidInputException("Project key is required");
        }
        String trimmed = raw.trim();
        if (trimmed.length() > ProjectsEntity.MAX_KEY_LENGTH) {
            throw new InvalidInputException("Project key must be at most " + ProjectsEntity.MAX_KEY_LENGTH + " characters");
        }
        // on the raw input: "ß" and dotless "ı" upper-case to ASCII
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            boolean alnum = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            if (!alnum) {
                throw new InvalidInputException("Project key must contain only ASCII letters and digits");
            }
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
