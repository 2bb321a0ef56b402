package com.agile.Buro.dto;

public record ErrorResponse(
        int status,
        String error,
        String message,
        String path
) {}
