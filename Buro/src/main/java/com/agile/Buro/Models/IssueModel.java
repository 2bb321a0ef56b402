package com.agile.Buro.Models;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class IssueModel {
    private UUID id;
    private String key;
    private int issueNumber;
    private UUID projectId;
    private String projectKey;
    private String title;
    private String description;
    private IssueType type;
    private IssueStatus status;
    private IssuePriority priority;
    private UserRef reporter;
    private UserRef assignee;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
