package com.agile.Buro.Service;

import com.agile.Buro.Models.ProjectMemberModel;
import com.agile.Buro.Models.ProjectModel;
import com.agile.Buro.Models.ProjectStatsModel;
import com.agile.Buro.dto.ProjectUpdate;
import com.agile.Buro.dto.request.ProjectCreateRequest;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.ProjectMemberEntity;
import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.ProjectKeyConflictException;
import com.agile.Buro.exception.ProjectNotFoundException;
import com.agile.Buro.exception.UserNotFoundException;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.ProjectMembersRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import com.agile.Buro.util.Mappers;
import com.agile.Buro.util.ProjectKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@Service
public class ProjectService {

    private final ProjectsRepository projectsRepository;
    private final ProjectMembersRepository membersRepository;
    private final IssuesRepository issuesRepository;
    private final UsersRepository usersRepository;
    private final AccessPolicy accessPolicy;
    private final ProjectMembershipLookup membership;

    public ProjectService(ProjectsRepository projectsRepository,
                          ProjectMembersRepository membersRepository,
                          IssuesRepository issuesRepository,
                          UsersRepository usersRepository,
                          AccessPolicy accessPolicy,
                          ProjectMembershipLookup membership) {
        this.projectsRepository = projectsRepository;
        this.membersRepository = membersRepository;
        this.issuesRepository = issuesRepository;
        this.usersRepository = usersRepository;
        this.accessPolicy = accessPolicy;
        this.membership = membership;
    }

    // ========== REGISTRY ==========

    @Transactional
    public ProjectModel createProject(ProjectCreateRequest req, UsersEntity caller) {
        if (!accessPolicy.canCreateProject(caller)) {
            throw new ForbiddenOperationException("Only admins and managers can create projects");
        }

        String key = ProjectKeys.normalize(req.key());
        String name = requireName(req.name());
        if (projectsRepository.existsByProjectKey(key)) {
            throw new ProjectKeyConflictException(key);
        }

        ProjectsEntity project = new ProjectsEntity();
        project.setName(name);
        project.setProjectKey(key);
        project.setDescription(trimToNull(req.description()));
        project.setOwner(caller);
        if (req.defaultAssigneeId() != null) {
            project.setDefaultAssignee(requireActiveUser(req.defaultAssigneeId(), "Default assignee"));
        }

        ProjectsEntity saved = projectsRepository.saveAndFlush(project);
        log.info("Project {} created by {}", saved.getProjectKey(), caller.getEmail());
        return Mappers.toProjectModel(saved);
    }

    @Transactional(readOnly = true)
    public ProjectModel getProject(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findWithOwnerByProjectId(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        requireAccess(caller, project);
        return Mappers.toProjectModel(project);
    }

    @Transactional(readOnly = true)
    public ProjectModel getProjectByKey(String key, UsersEntity caller) {
        String normalized = key == null ? "" : key.trim().toUpperCase(Locale.ROOT);
        ProjectsEntity project = projectsRepository.findByProjectKey(normalized)
                .orElseThrow(ProjectNotFoundException::new);
        requireAccess(caller, project);
        return Mappers.toProjectModel(project);
    }

    @Transactional
    public ProjectModel updateProject(UUID projectId, ProjectUpdate update, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findWithOwnerByProjectId(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        if (!accessPolicy.canManageProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to update this project");
        }

        for (ProjectUpdate.Field field : update.fields()) {
            switch (field) {
                case NAME -> project.setName(requireName(update.name()));
                case KEY -> applyKey(project, update.key());
                case DESCRIPTION -> project.setDescription(trimToNull(update.description()));
                case DEFAULT_ASSIGNEE -> project.setDefaultAssignee(update.defaultAssigneeId() == null
                        ? null
                        : requireActiveUser(update.defaultAssigneeId(), "Default assignee"));
            }
        }

        ProjectsEntity saved = projectsRepository.saveAndFlush(project);
        log.info("Project {} updated by {} ({})", saved.getProjectKey(), caller.getEmail(), update.fields());
        return Mappers.toProjectModel(saved);
    }

    private void applyKey(ProjectsEntity project, String rawKey) {
        String key = ProjectKeys.normalize(rawKey);
        if (key.equals(project.getProjectKey())) {
            return;
        }
        if (projectsRepository.existsByProjectKeyAndProjectIdNot(key, project.getProjectId())) {
            throw new ProjectKeyConflictException(key);
        }
        log.info("Project key {} renamed to {}", project.getProjectKey(), key);
        project.setProjectKey(key);
    }

    @Transactional
    public void deleteProject(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        if (!accessPolicy.canManageProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to delete this project");
        }
        projectsRepository.delete(project);
        log.info("Project {} deleted by {}", project.getProjectKey(), caller.getEmail());
    }

    @Transactional(readOnly = true)
    public List<ProjectModel> listUserProjects(UsersEntity caller) {
        return listUserProjectEntities(caller).stream().map(Mappers::toProjectModel).toList();
    }

    /** Admins get everything; others get owned plus member projects. */
    @Transactional(readOnly = true)
    public List<ProjectsEntity> listUserProjectEntities(UsersEntity caller) {
        if (caller.isAdmin() || accessibleProjectIds(caller).isEmpty()) {
            return projectsRepository.findAllByOrderByCreatedAtDesc();
        }
        return projectsRepository.findAccessibleByUserId(caller.getUserId());
    }

    /**
     * Projects the caller may see in listings, or empty when nothing restricts them.
     */
    @Transactional(readOnly = true)
    public Optional<Set<UUID>> accessibleProjectIds(UsersEntity caller) {
        if (caller.isAdmin()) {
            return Optional.empty();
        }
        Optional<Set<UUID>> memberIds = membership.memberProjectIds(caller.getUserId());
        if (memberIds.isEmpty()) {
            return Optional.empty();
        }
        Set<UUID> ids = new HashSet<>(memberIds.get());
        projectsRepository.findByOwner_UserId(caller.getUserId())
                .forEach(p -> ids.add(p.getProjectId()));
        return Optional.of(ids);
    }

    // ========== STATS ==========

    @Transactional(readOnly = true)
    public ProjectStatsModel getProjectStats(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId).orElse(null);
        if (project == null || !accessPolicy.canViewProjectStats(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to view project stats");
        }

        Map<String, Long> byStatus = countByStatus(projectId);
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        long completed = byStatus.get(IssueStatus.DONE.value());

        ProjectStatsModel stats = new ProjectStatsModel();
        stats.setProject(new ProjectStatsModel.ProjectInfo(project.getProjectId(), project.getProjectKey(), project.getName()));
        stats.setIssues(byStatus);
        stats.setTotals(new ProjectStatsModel.Totals(total, completed, total == 0 ? 0.0 : (double) completed / total));
        return stats;
    }

    /** Issue counts for every status, zero when a status has no issues. */
    @Transactional(readOnly = true)
    public Map<String, Long> countByStatus(UUID projectId) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (IssueStatus status : IssueStatus.values()) {
            byStatus.put(status.value(), 0L);
        }
        issuesRepository.countByStatus(projectId)
                .forEach(row -> byStatus.put(row.getStatus().value(), row.getTotal()));
        return byStatus;
    }

    // ========== MEMBERS ==========

    @Transactional(readOnly = true)
    public List<ProjectMemberModel> listMembers(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findWithOwnerByProjectId(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        requireAccess(caller, project);

        List<ProjectMemberModel> result = new ArrayList<>();
        result.add(new ProjectMemberModel(Mappers.toUserRef(project.getOwner()), true, project.getCreatedAt()));
        for (ProjectMemberEntity m : membersRepository.findByProject_ProjectIdOrderByAddedAtAsc(projectId)) {
            if (!project.isOwnedBy(m.getUser().getUserId())) {
                result.add(new ProjectMemberModel(Mappers.toUserRef(m.getUser()), false, m.getAddedAt()));
            }
        }
        return result;
    }

    @Transactional
    public ProjectMemberModel addMember(UUID projectId, UUID userId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        if (!accessPolicy.canManageProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to manage project members");
        }
        UsersEntity user = requireActiveUser(userId, "Member");
        if (project.isOwnedBy(userId)) {
            throw new InvalidInputException("The owner is already a member of the project");
        }

        ProjectMemberEntity member = membersRepository.findByProject_ProjectIdAndUser_UserId(projectId, userId)
                .orElseGet(() -> {
                    log.info("User {} added to project {}", user.getEmail(), project.getProjectKey());
                    return membersRepository.saveAndFlush(new ProjectMemberEntity(project, user));
                });
        return new ProjectMemberModel(Mappers.toUserRef(user), false, member.getAddedAt());
    }

    @Transactional
    public void removeMember(UUID projectId, UUID userId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        if (!accessPolicy.canManageProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to manage project members");
        }
        if (project.isOwnedBy(userId)) {
            throw new InvalidInputException("The project owner cannot be removed");
        }
        ProjectMemberEntity member = membersRepository.findByProject_ProjectIdAndUser_UserId(projectId, userId)
                .orElseThrow(UserNotFoundException::new);
        membersRepository.delete(member);
        log.info("User {} removed from project {}", userId, project.getProjectKey());
    }

    // ========== HELPERS ==========

    private void requireAccess(UsersEntity caller, ProjectsEntity project) {
        if (!accessPolicy.canAccessProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to access this project");
        }
    }

    private UsersEntity requireActiveUser(UUID userId, String label) {
        return usersRepository.findById(userId)
                .filter(UsersEntity::isActive)
                .orElseThrow(() -> new InvalidInputException(label + " not found or inactive"));
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidInputException("Project name must not be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > ProjectsEntity.MAX_NAME_LENGTH) {
            throw new InvalidInputException("Project name must be at most " + ProjectsEntity.MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
