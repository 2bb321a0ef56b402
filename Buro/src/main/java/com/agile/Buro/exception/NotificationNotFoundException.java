package com.agile.Buro.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class NotificationNotFoundException extends ResponseStatusException {
    public NotificationNotFoundException() {
        super(HttpStatus.NOT_FOUND, "Notification not found");
    }
}
