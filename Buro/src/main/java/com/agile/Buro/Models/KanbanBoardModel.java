package com.agile.Buro.Models;

import com.agile.Buro.entity.IssueStatus;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class KanbanBoardModel {
    private UUID projectId;
    private String projectKey;
    private List<Column> columns;

    public record Column(IssueStatus status, int count, List<IssueModel> issues) {}
}
