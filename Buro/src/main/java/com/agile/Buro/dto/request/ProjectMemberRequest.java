package com.agile.Buro.dto.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ProjectMemberRequest(
        @NotNull(message = "userId is required") UUID userId
) {}
