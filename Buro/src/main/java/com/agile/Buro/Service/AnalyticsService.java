package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.AnalyticsModel;
import com.agile.Buro.Models.AnalyticsModel.AgingGroups;
import com.agile.Buro.Models.AnalyticsModel.AgingIssue;
import com.agile.Buro.Models.AnalyticsModel.MemberVelocity;
import com.agile.Buro.Models.AnalyticsModel.StatusAging;
import com.agile.Buro.Models.AnalyticsModel.WorkloadEntry;
import com.agile.Buro.Models.ProjectStatsModel;
import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.ProjectNotFoundException;
import com.agile.Buro.exception.UserNotFoundException;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Read-only project metrics. Empty projects and empty scopes yield zeros, never errors.
 */
@Service
@Transactional(readOnly = true)
public class AnalyticsService {

    static final int BURNDOWN_STEPS = 10;
    static final int DEFAULT_WEEKS = 4;
    static final int MAX_WEEKS = 52;
    static final String UNASSIGNED = "Unassigned";

    private final IssuesRepository issuesRepository;
    private final ProjectsRepository projectsRepository;
    private final UsersRepository usersRepository;
    private final ProjectService projectService;
    private final AccessPolicy accessPolicy;
    private final BuroProperties properties;
    private final Clock clock;

    public AnalyticsService(IssuesRepository issuesRepository,
                            ProjectsRepository projectsRepository,
                            UsersRepository usersRepository,
                            ProjectService projectService,
                            AccessPolicy accessPolicy,
                            BuroProperties properties,
                            Clock clock) {
        this.issuesRepository = issuesRepository;
        this.projectsRepository = projectsRepository;
        this.usersRepository = usersRepository;
        this.projectService = projectService;
        this.accessPolicy = accessPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    // ========== PROJECT ==========

    public AnalyticsModel.ProjectOverviewDTO projectOverview(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = requireAnalyticsAccess(projectId, caller);
        LocalDateTime now = LocalDateTime.now(clock);

        Map<String, Long> byStatus = projectService.countByStatus(projectId);
        long total = sum(byStatus.values());
        long completed = byStatus.get(IssueStatus.DONE.value());

        int days = properties.getAnalytics().getVelocityDays();
        long recentlyDone = issuesRepository.countByProject_ProjectIdAndStatusAndUpdatedAtGreaterThanEqual(
                projectId, IssueStatus.DONE, now.minusDays(days));
        AnalyticsModel.VelocityDTO velocity = new AnalyticsModel.VelocityDTO(
                days, recentlyDone, round(days > 0 ? (double) recentlyDone / days : 0.0, 2));

        AgingGroups aging = groups(issuesRepository.findAgesByProjectIds(List.of(projectId)), now);

        return new AnalyticsModel.ProjectOverviewDTO(info(project), total, completed,
                percent(completed, total), byStatus, velocity, aging.counts(), aging, now);
    }

    public AnalyticsModel.BurndownDTO burndown(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = requireAnalyticsAccess(projectId, caller);

        Map<String, Long> byStatus = projectService.countByStatus(projectId);
        long total = sum(byStatus.values());
        long completed = byStatus.get(IssueStatus.DONE.value());
        long remaining = total - completed;

        List<String> labels = new ArrayList<>(BURNDOWN_STEPS + 1);
        List<Long> ideal = new ArrayList<>(BURNDOWN_STEPS + 1);
        List<Long> actual = new ArrayList<>(BURNDOWN_STEPS + 1);
        for (int i = 0; i <= BURNDOWN_STEPS; i++) {
            labels.add("Period " + (i + 1));
            ideal.add(Math.round(total * (BURNDOWN_STEPS - i) / (double) BURNDOWN_STEPS));
            actual.add(i == 0 ? total : remaining);
        }

        return new AnalyticsModel.BurndownDTO(info(project), labels, ideal, actual,
                total, completed, remaining, percent(completed, total));
    }

    // ========== VELOCITY ==========

    public AnalyticsModel.UserVelocityDTO userVelocity(UUID userId, Integer weeks, UsersEntity caller) {
        int w = resolveWeeks(weeks);
        if (!caller.isAdmin() && !caller.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Not enough permissions to view this user's velocity");
        }
        UsersEntity user = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);

        LocalDateTime since = LocalDateTime.now(clock).minusWeeks(w);
        long done = issuesRepository.countByAssignee_UserIdAndStatusAndUpdatedAtGreaterThanEqual(
                userId, IssueStatus.DONE, since);
        return new AnalyticsModel.UserVelocityDTO(user.getUserId(), user.getFullName(), w, done,
                round((double) done / w, 1));
    }

    public AnalyticsModel.TeamVelocityDTO teamVelocity(Integer weeks, UUID projectId, UsersEntity caller) {
        int w = resolveWeeks(weeks);
        if (projectId != null) {
            ProjectsEntity project = projectsRepository.findById(projectId)
                    .orElseThrow(ProjectNotFoundException::new);
            if (!accessPolicy.canAccessProject(caller, project)) {
                throw new ForbiddenOperationException("Not enough permissions to access this project");
            }
        }

        List<UsersEntity> team = caller.isAdmin()
                ? usersRepository.findByActiveTrueOrderByFullNameAsc()
                : List.of(caller);
        LocalDateTime since = LocalDateTime.now(clock).minusWeeks(w);

        List<MemberVelocity> members = new ArrayList<>(team.size());
        long totalCompleted = 0;
        for (UsersEntity member : team) {
            long done = projectId == null
                    ? issuesRepository.countByAssignee_UserIdAndStatusAndUpdatedAtGreaterThanEqual(
                            member.getUserId(), IssueStatus.DONE, since)
                    : issuesRepository.countByAssignee_UserIdAndProject_ProjectIdAndStatusAndUpdatedAtGreaterThanEqual(
                            member.getUserId(), projectId, IssueStatus.DONE, since);
            totalCompleted += done;
            members.add(new MemberVelocity(member.getUserId(), member.getFullName(), member.getEmail(), done));
        }

        double average = team.isEmpty() ? 0.0 : round((double) totalCompleted / team.size(), 1);
        return new AnalyticsModel.TeamVelocityDTO(w, projectId, team.size(), totalCompleted, average, members);
    }

    // ========== AGING & WORKLOAD ==========

    public AnalyticsModel.AgingReportDTO agingReport(List<UUID> projectIds, UsersEntity caller) {
        List<UUID> scope = resolveScope(projectIds, caller);
        LocalDateTime now = LocalDateTime.now(clock);

        List<IssuesRepository.IssueAge> ages = scope.isEmpty()
                ? List.of()
                : issuesRepository.findAgesByProjectIds(scope);

        Map<IssueStatus, List<AgingIssue>> entriesByStatus = new EnumMap<>(IssueStatus.class);
        for (IssueStatus status : IssueStatus.values()) {
            entriesByStatus.put(status, new ArrayList<>());
        }
        ages.forEach(a -> entriesByStatus.get(a.getStatus()).add(agingIssue(a, now)));

        Map<String, StatusAging> byStatus = new LinkedHashMap<>();
        Map<String, List<AgingIssue>> issuesByStatus = new LinkedHashMap<>();
        entriesByStatus.forEach((status, entries) -> {
            byStatus.put(status.value(), summarize(entries.stream().map(AgingIssue::days).toList()));
            issuesByStatus.put(status.value(), entries);
        });

        return new AnalyticsModel.AgingReportDTO(scope, ages.size(), byStatus, issuesByStatus,
                groups(ages, now).counts(), now);
    }

    public AnalyticsModel.WorkloadDTO workload(List<UUID> projectIds, UsersEntity caller) {
        List<IssuesRepository.AssigneeLoad> rows;
        if (projectIds != null && !projectIds.isEmpty()) {
            rows = issuesRepository.sumWorkloadInProjects(IssueStatus.DONE, resolveScope(projectIds, caller));
        } else {
            Optional<Set<UUID>> visible = projectService.accessibleProjectIds(caller);
            if (visible.isEmpty()) {
                rows = issuesRepository.sumWorkload(IssueStatus.DONE);
            } else if (visible.get().isEmpty()) {
                rows = List.of();
            } else {
                rows = issuesRepository.sumWorkloadInProjects(IssueStatus.DONE, visible.get());
            }
        }

        Map<UUID, Map<String, Long>> byAssignee = new LinkedHashMap<>();
        for (IssuesRepository.AssigneeLoad row : rows) {
            byAssignee.computeIfAbsent(row.getAssigneeId(), id -> emptyPriorityMap())
                    .merge(row.getPriority().value(), row.getTotal(), Long::sum);
        }

        Map<UUID, UsersEntity> users = new HashMap<>();
        usersRepository.findAllById(byAssignee.keySet()).forEach(u -> users.put(u.getUserId(), u));

        List<WorkloadEntry> entries = new ArrayList<>(byAssignee.size());
        byAssignee.forEach((userId, byPriority) -> {
            UsersEntity u = users.get(userId);
            long score = 0;
            for (IssuePriority p : IssuePriority.values()) {
                score += (long) p.getWeight() * byPriority.get(p.value());
            }
            entries.add(new WorkloadEntry(userId,
                    u != null ? u.getFullName() : null,
                    u != null ? u.getEmail() : null,
                    sum(byPriority.values()), byPriority, score));
        });
        entries.sort(Comparator.comparingLong(WorkloadEntry::workloadScore).reversed()
                .thenComparing(WorkloadEntry::fullName, Comparator.nullsLast(Comparator.naturalOrder())));

        long totalActive = entries.stream().mapToLong(WorkloadEntry::totalIssues).sum();
        return new AnalyticsModel.WorkloadDTO(entries, entries.size(), totalActive, LocalDateTime.now(clock));
    }

    // ========== DASHBOARD ==========

    public List<AnalyticsModel.DashboardDTO> dashboard(UsersEntity caller) {
        List<ProjectsEntity> projects = projectService.listUserProjectEntities(caller);
        List<AnalyticsModel.DashboardDTO> result = new ArrayList<>(projects.size());
        for (ProjectsEntity project : projects) {
            Map<String, Long> byStatus = projectService.countByStatus(project.getProjectId());
            long total = sum(byStatus.values());
            long done = byStatus.get(IssueStatus.DONE.value());
            result.add(new AnalyticsModel.DashboardDTO(project.getProjectId(), project.getProjectKey(),
                    project.getName(), total, done, percent(done, total)));
        }
        return result;
    }

    // ========== HELPERS ==========

    private ProjectsEntity requireAnalyticsAccess(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        if (!accessPolicy.canViewProjectAnalytics(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to view project analytics");
        }
        return project;
    }

    /** Explicit ids must all be accessible; no ids means every project the caller can list. */
    private List<UUID> resolveScope(List<UUID> projectIds, UsersEntity caller) {
        if (projectIds == null || projectIds.isEmpty()) {
            return projectService.listUserProjectEntities(caller).stream()
                    .map(ProjectsEntity::getProjectId)
                    .toList();
        }
        List<UUID> scope = new ArrayList<>(new LinkedHashSet<>(projectIds));
        for (UUID id : scope) {
            ProjectsEntity project = projectsRepository.findById(id).orElseThrow(ProjectNotFoundException::new);
            if (!accessPolicy.canAccessProject(caller, project)) {
                throw new ForbiddenOperationException("Not enough permissions to access project " + id);
            }
        }
        return scope;
    }

    private static int resolveWeeks(Integer weeks) {
        int w = weeks == null ? DEFAULT_WEEKS : weeks;
        if (w < 1 || w > MAX_WEEKS) {
            throw new InvalidInputException("weeks must be between 1 and " + MAX_WEEKS);
        }
        return w;
    }

    static AgingGroups groups(List<IssuesRepository.IssueAge> ages, LocalDateTime now) {
        List<AgingIssue> fresh = new ArrayList<>();
        List<AgingIssue> normal = new ArrayList<>();
        List<AgingIssue> aging = new ArrayList<>();
        List<AgingIssue> stalled = new ArrayList<>();
        for (IssuesRepository.IssueAge a : ages) {
            if (a.getStatus() == IssueStatus.DONE) continue;
            AgingIssue entry = agingIssue(a, now);
            if (entry.days() <= 1) fresh.add(entry);
            else if (entry.days() <= 3) normal.add(entry);
            else if (entry.days() <= 7) aging.add(entry);
            else stalled.add(entry);
        }
        return new AgingGroups(fresh, normal, aging, stalled);
    }

    private static AgingIssue agingIssue(IssuesRepository.IssueAge a, LocalDateTime now) {
        return new AgingIssue(ProjectsEntity.issueKey(a.getProjectKey(), a.getIssueNumber()), a.getTitle(),
                daysSince(a.getUpdatedAt(), now), a.getStatus().value(),
                a.getAssigneeName() != null ? a.getAssigneeName() : UNASSIGNED);
    }

    static StatusAging summarize(List<Long> days) {
        if (days.isEmpty()) {
            return new StatusAging(0, 0.0, 0, 0);
        }
        LongSummaryStatistics s = days.stream().mapToLong(Long::longValue).summaryStatistics();
        return new StatusAging(s.getCount(), round(s.getAverage(), 1), s.getMax(), s.getMin());
    }

    private static long daysSince(LocalDateTime updatedAt, LocalDateTime now) {
        if (updatedAt == null) return 0;
        return Math.max(0, Duration.between(updatedAt, now).toDays());
    }

    private static Map<String, Long> emptyPriorityMap() {
        Map<String, Long> m = new LinkedHashMap<>();
        for (IssuePriority p : IssuePriority.values()) {
            m.put(p.value(), 0L);
        }
        return m;
    }

    private static ProjectStatsModel.ProjectInfo info(ProjectsEntity project) {
        return new ProjectStatsModel.ProjectInfo(project.getProjectId(), project.getProjectKey(), project.getName());
    }

    private static long sum(Collection<Long> values) {
        return values.stream().mapToLong(Long::longValue).sum();
    }

    static double percent(long part, long total) {
        return total == 0 ? 0.0 : round(part * 100.0 / total, 1);
    }

    static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
