package com.agile.Buro.dto.request;

import com.agile.Buro.dto.ProjectUpdate;

import java.util.UUID;

public class ProjectUpdateRequest extends UnknownFieldCollector {

    private final ProjectUpdate.Builder builder = ProjectUpdate.builder();

    public void setName(String name) { builder.name(name); }
    public void setKey(String key) { builder.key(key); }
    public void setDescription(String description) { builder.description(description); }
    public void setDefaultAssigneeId(UUID userId) { builder.defaultAssignee(userId); }

    public ProjectUpdate toUpdate() {
        rejectUnknownFields();
        return builder.build();
    }
}
