package com.agile.Buro.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record ProjectCreateRequest(
        @NotBlank(message = "Project name is required") @Size(max = 255) String name,
        @NotBlank(message = "Project key is required") String key,
        String description,
        UUID defaultAssigneeId
) {}
