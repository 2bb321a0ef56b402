package com.agile.Buro.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class UnauthenticatedException extends ResponseStatusException {
    public UnauthenticatedException(String reason) {
        super(HttpStatus.UNAUTHORIZED, reason);
    }
}
