package com.agile.Buro.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class InvalidInputException extends ResponseStatusException {
    public InvalidInputException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
