package com.agile.Buro.dto;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;

import java.util.UUID;

/** Equality filters for issue listings; {@code null} components are ignored. */
public record IssueFilter(UUID projectId,
                          UUID assigneeId,
                          UUID reporterId,
                          IssueStatus status,
                          IssueType type,
                          IssuePriority priority) {

    public static IssueFilter none() {
        return new IssueFilter(null, null, null, null, null, null);
    }
}
