package com.agile.Buro.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProjectKeyConflictException extends ResponseStatusException {
    public ProjectKeyConflictException(String key) {
        super(HttpStatus.CONFLICT, "Project key '" + key + "' already exists");
    }
}
