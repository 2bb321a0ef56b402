package com.agile.Buro.dto.request;

import com.agile.Buro.dto.IssueUpdate;
import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;

import java.util.UUID;

/**
 * PUT body for an issue. Only the fields present in the JSON are applied; an explicit
 * {@code "assigneeId": null} unassigns.
 */
public class IssueUpdateRequest extends UnknownFieldCollector {

    private final IssueUpdate.Builder builder = IssueUpdate.builder();

    public void setTitle(String title) { builder.title(title); }
    public void setDescription(String description) { builder.description(description); }
    public void setType(IssueType type) { builder.type(type); }
    public void setPriority(IssuePriority priority) { builder.priority(priority); }
    public void setAssigneeId(UUID assigneeId) { builder.assignee(assigneeId); }
    public void setStatus(IssueStatus status) { builder.status(status); }

    public IssueUpdate toUpdate() {
        rejectUnknownFields();
        return builder.build();
    }
}
