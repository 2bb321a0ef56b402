package com.agile.Buro.dto.request;

import com.agile.Buro.entity.IssueStatus;
import jakarta.validation.constraints.NotNull;

public record IssueStatusRequest(
        @NotNull(message = "status is required") IssueStatus status
) {}
