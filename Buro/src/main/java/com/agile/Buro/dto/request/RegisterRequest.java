package com.agile.Buro.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "Email is required") String email,
        @NotBlank(message = "Full name is required") @Size(max = 255) String fullName,
        @NotBlank(message = "Password is required") String password
) {}
