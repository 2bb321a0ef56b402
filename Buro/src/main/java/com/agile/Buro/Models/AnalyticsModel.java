package com.agile.Buro.Models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
public class AnalyticsModel {

    /** Non-done issues by days since last update: fresh <= 1, normal <= 3, aging <= 7, stalled > 7. */
    public record AgingBuckets(long fresh, long normal, long aging, long stalled) {
        public static AgingBuckets empty() {
            return new AgingBuckets(0, 0, 0, 0);
        }
    }

    public record AgingIssue(String key, String title, long days, String status, String assignee) {}

    /** The non-done issues behind {@link AgingBuckets}, most recently updated first. */
    public record AgingGroups(List<AgingIssue> fresh,
                              List<AgingIssue> normal,
                              List<AgingIssue> aging,
                              List<AgingIssue> stalled) {

        public AgingBuckets counts() {
            return new AgingBuckets(fresh.size(), normal.size(), aging.size(), stalled.size());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectOverviewDTO {
        private ProjectStatsModel.ProjectInfo project;
        private long totalIssues;
        private long completedIssues;
        /** percent, one decimal */
        private double completionRate;
        private Map<String, Long> issuesByStatus;
        private VelocityDTO velocity;
        private AgingBuckets aging;
        private AgingGroups agingIssues;
        private LocalDateTime generatedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VelocityDTO {
        private int periodDays;
        private long completedIssues;
        private double dailyAverage;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BurndownDTO {
        private ProjectStatsModel.ProjectInfo project;
        private List<String> labels;
        private List<Long> ideal;
        private List<Long> actual;
        private long totalIssues;
        private long completedIssues;
        private long remainingIssues;
        private double completionRate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserVelocityDTO {
        private UUID userId;
        private String fullName;
        private int periodWeeks;
        private long completedIssues;
        private double weeklyAverage;
    }

    public record MemberVelocity(UUID userId, String fullName, String email, long completedIssues) {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TeamVelocityDTO {
        private int periodWeeks;
        private UUID projectId;
        private int teamSize;
        private long totalCompleted;
        private double averageVelocity;
        private List<MemberVelocity> members;
    }

    public record StatusAging(long count, double averageDays, long maxDays, long minDays) {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgingReportDTO {
        private List<UUID> projectIds;
        private long totalIssues;
        private Map<String, StatusAging> byStatus;
        /** every status present, issues most recently updated first */
        private Map<String, List<AgingIssue>> issuesByStatus;
        private AgingBuckets buckets;
        private LocalDateTime generatedAt;
    }

    public record WorkloadEntry(UUID userId,
                                String fullName,
                                String email,
                                long totalIssues,
                                Map<String, Long> byPriority,
                                long workloadScore) {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkloadDTO {
        private List<WorkloadEntry> entries;
        private int totalAssignees;
        private long totalActiveIssues;
        private LocalDateTime generatedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DashboardDTO {
        private UUID projectId;
        private String projectKey;
        private String projectName;
        private long totalIssues;
        private long completedIssues;
        private double completionRate;
    }
}
