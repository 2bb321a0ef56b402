package com.agile.Buro.Models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ProjectModel {
    private UUID id;
    private String name;
    private String key;
    private String description;
    private UserRef owner;
    private UserRef defaultAssignee;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
