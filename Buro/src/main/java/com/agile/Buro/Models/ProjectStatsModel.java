package com.agile.Buro.Models;

import lombok.Data;

import java.util.Map;
import java.util.UUID;

@Data
public class ProjectStatsModel {

    private ProjectInfo project;
    private Map<String, Long> issues;
    private Totals totals;

    public record ProjectInfo(UUID id, String key, String name) {}

    /** completionRate is a ratio in [0, 1]. */
    public record Totals(long total, long completed, double completionRate) {}
}
