package com.agile.Buro.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ForbiddenOperationException extends ResponseStatusException {
    public ForbiddenOperationException(String reason) {
        super(HttpStatus.FORBIDDEN, reason);
    }
}
