package com.agile.Buro.dto.request;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
public class IssueCreateRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 500)
    private String title;

    private String description;

    private IssueType type = IssueType.TASK;

    private IssuePriority priority = IssuePriority.MEDIUM;

    @NotNull(message = "projectId is required")
    private UUID projectId;

    private UUID assigneeId;
}
