package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.IssueModel;
import com.agile.Buro.Models.KanbanBoardModel;
import com.agile.Buro.Models.PageModel;
import com.agile.Buro.dto.IssueFilter;
import com.agile.Buro.dto.IssueUpdate;
import com.agile.Buro.dto.request.IssueCreateRequest;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssuesEntity;
import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.IssueNotFoundException;
import com.agile.Buro.exception.ProjectNotFoundException;
import com.agile.Buro.repository.IssueSpecifications;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import com.agile.Buro.util.Mappers;
import com.agile.Buro.util.OffsetPageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@Service
public class IssueService {

    private final IssuesRepository issuesRepository;
    private final ProjectsRepository projectsRepository;
    private final UsersRepository usersRepository;
    private final AccessPolicy accessPolicy;
    private final ProjectService projectService;
    private final NotificationDispatcher notifications;
    private final BuroProperties properties;

    public IssueService(IssuesRepository issuesRepository,
                        ProjectsRepository projectsRepository,
                        UsersRepository usersRepository,
                        AccessPolicy accessPolicy,
                        ProjectService projectService,
                        NotificationDispatcher notifications,
                        BuroProperties properties) {
        this.issuesRepository = issuesRepository;
        this.projectsRepository = projectsRepository;
        this.usersRepository = usersRepository;
        this.accessPolicy = accessPolicy;
        this.projectService = projectService;
        this.notifications = notifications;
        this.properties = properties;
    }

    // ========== CREATE ==========

    /**
     * Creates an issue in BACKLOG. The project row stays locked until commit, so two
     * creations in the same project never see the same next number.
     */
    @Transactional
    public IssueModel createIssue(IssueCreateRequest req, UsersEntity reporter) {
        ProjectsEntity project = projectsRepository.findByIdForUpdate(req.getProjectId())
                .orElseThrow(ProjectNotFoundException::new);
        requireAccess(reporter, project);

        String title = requireText(req.getTitle(), "Title", IssuesEntity.MAX_TITLE_LENGTH);
        UsersEntity assignee = req.getAssigneeId() != null
                ? requireActiveAssignee(req.getAssigneeId())
                : activeOrNull(project.getDefaultAssignee());

        int number = project.allocateIssueNumber(issuesRepository.findMaxIssueNumber(project.getProjectId()));

        IssuesEntity issue = new IssuesEntity();
        issue.setProject(project);
        issue.setIssueNumber(number);
        issue.setTitle(title);
        issue.setDescription(trimToNull(req.getDescription()));
        if (req.getType() != null) issue.setType(req.getType());
        if (req.getPriority() != null) issue.setPriority(req.getPriority());
        issue.setStatus(IssueStatus.BACKLOG);
        issue.setReporter(reporter);
        issue.setAssignee(assignee);

        IssuesEntity saved = issuesRepository.saveAndFlush(issue);
        log.info("Issue {} created by {}", project.issueKey(number), reporter.getEmail());

        if (assignee != null) {
            notifications.dispatch(NotificationMessages.issueAssigned(saved, assignee, reporter));
        }
        return Mappers.toIssueModel(saved);
    }

    // ========== READ ==========

    @Transactional(readOnly = true)
    public IssueModel getIssue(UUID issueId, UsersEntity caller) {
        return Mappers.toIssueModel(loadAccessible(issueId, caller));
    }

    @Transactional(readOnly = true)
    public IssueModel getIssueByKey(String projectKey, int issueNumber, UsersEntity caller) {
        String key = projectKey == null ? "" : projectKey.trim().toUpperCase(Locale.ROOT);
        ProjectsEntity project = projectsRepository.findByProjectKey(key)
                .orElseThrow(ProjectNotFoundException::new);
        IssuesEntity issue = issuesRepository.findByProject_ProjectIdAndIssueNumber(project.getProjectId(), issueNumber)
                .orElseThrow(IssueNotFoundException::new);
        requireAccess(caller, project);
        return Mappers.toIssueModel(issue);
    }

    @Transactional(readOnly = true)
    public PageModel<IssueModel> listIssues(IssueFilter filter, UsersEntity caller, Integer skip, Integer limit) {
        IssueFilter f = filter == null ? IssueFilter.none() : filter;
        OffsetPageRequest page = OffsetPageRequest.of(skip, limit,
                properties.getIssues().getDefaultPageSize(),
                properties.getIssues().getMaxPageSize(),
                Sort.by(Sort.Direction.DESC, "updatedAt"));

        Specification<IssuesEntity> spec = Specification.where(IssueSpecifications.inProject(f.projectId()))
                .and(IssueSpecifications.assignedTo(f.assigneeId()))
                .and(IssueSpecifications.reportedBy(f.reporterId()))
                .and(IssueSpecifications.hasStatus(f.status()))
                .and(IssueSpecifications.hasType(f.type()))
                .and(IssueSpecifications.hasPriority(f.priority()));

        if (f.projectId() != null) {
            ProjectsEntity project = projectsRepository.findById(f.projectId())
                    .orElseThrow(ProjectNotFoundException::new);
            requireAccess(caller, project);
        } else {
            Optional<Set<UUID>> visible = projectService.accessibleProjectIds(caller);
            if (visible.isPresent()) {
                spec = spec.and(IssueSpecifications.inProjects(visible.get()));
            }
        }

        Page<IssuesEntity> result = issuesRepository.findAll(spec, page);
        List<IssueModel> items = result.getContent().stream().map(Mappers::toIssueModel).toList();
        return new PageModel<>(items, result.getTotalElements(), page.getOffset(), page.getPageSize());
    }

    @Transactional(readOnly = true)
    public KanbanBoardModel kanbanBoard(UUID projectId, UsersEntity caller) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(ProjectNotFoundException::new);
        requireAccess(caller, project);

        Map<IssueStatus, List<IssueModel>> byStatus = new EnumMap<>(IssueStatus.class);
        for (IssueStatus status : IssueStatus.values()) {
            byStatus.put(status, new ArrayList<>());
        }
        issuesRepository.findByProject_ProjectIdOrderByUpdatedAtDesc(projectId,
                        PageRequest.of(0, properties.getIssues().getKanbanLimit()))
                .forEach(issue -> byStatus.get(issue.getStatus()).add(Mappers.toIssueModel(issue)));

        KanbanBoardModel board = new KanbanBoardModel();
        board.setProjectId(project.getProjectId());
        board.setProjectKey(project.getProjectKey());
        board.setColumns(byStatus.entrySet().stream()
                .map(e -> new KanbanBoardModel.Column(e.getKey(), e.getValue().size(), e.getValue()))
                .toList());
        return board;
    }

    // ========== UPDATE ==========

    @Transactional
    public IssueModel updateIssue(UUID issueId, IssueUpdate update, UsersEntity caller) {
        IssuesEntity issue = loadAccessible(issueId, caller);
        UsersEntity newAssignee = null;

        for (IssueUpdate.Field field : update.fields()) {
            switch (field) {
                case TITLE -> issue.setTitle(requireText(update.title(), "Title", IssuesEntity.MAX_TITLE_LENGTH));
                case DESCRIPTION -> issue.setDescription(update.description() == null
                        ? null
                        : requireText(update.description(), "Description", Integer.MAX_VALUE));
                case TYPE -> issue.setType(requireValue(update.type(), "type"));
                case PRIORITY -> issue.setPriority(requireValue(update.priority(), "priority"));
                case ASSIGNEE -> newAssignee = applyAssignee(issue, update.assigneeId());
                case STATUS -> changeStatus(issue, requireValue(update.status(), "status"), caller);
            }
        }

        IssuesEntity saved = issuesRepository.saveAndFlush(issue);
        if (newAssignee != null) {
            notifications.dispatch(NotificationMessages.issueAssigned(saved, newAssignee, caller));
        }
        return Mappers.toIssueModel(saved);
    }

    /** Returns the new assignee when the issue moved to a different user, otherwise null. */
    private UsersEntity applyAssignee(IssuesEntity issue, UUID assigneeId) {
        UsersEntity previous = issue.getAssignee();
        if (assigneeId == null) {
            issue.setAssignee(null);
            return null;
        }
        UsersEntity assignee = requireActiveAssignee(assigneeId);
        issue.setAssignee(assignee);
        boolean changed = previous == null || !previous.getUserId().equals(assigneeId);
        return changed ? assignee : null;
    }

    @Transactional
    public IssueModel transitionStatus(UUID issueId, IssueStatus newStatus, UsersEntity caller) {
        if (newStatus == null) {
            throw new InvalidInputException("status is required");
        }
        IssuesEntity issue = loadAccessible(issueId, caller);
        if (changeStatus(issue, newStatus, caller)) {
            issue = issuesRepository.saveAndFlush(issue);
        }
        return Mappers.toIssueModel(issue);
    }

    /**
     * Any status may follow any other. Returns false when the issue already had the status.
     */
    private boolean changeStatus(IssuesEntity issue, IssueStatus to, UsersEntity actor) {
        IssueStatus from = issue.getStatus();
        if (from == to) {
            return false;
        }
        issue.setStatus(to);

        String key = issue.getProject().issueKey(issue.getIssueNumber());
        if (to.isBefore(from)) {
            log.info("Issue {} moved back from {} to {} by {}", key, from, to, actor.getEmail());
        } else {
            log.info("Issue {} moved from {} to {} by {}", key, from, to, actor.getEmail());
        }

        Map<UUID, UsersEntity> recipients = new LinkedHashMap<>();
        if (issue.getReporter() != null) recipients.put(issue.getReporter().getUserId(), issue.getReporter());
        if (issue.getAssignee() != null) recipients.put(issue.getAssignee().getUserId(), issue.getAssignee());
        recipients.remove(actor.getUserId());
        recipients.values().forEach(r ->
                notifications.dispatch(NotificationMessages.statusChanged(issue, r, actor, from, to)));
        return true;
    }

    // ========== DELETE ==========

    @Transactional
    public void deleteIssue(UUID issueId, UsersEntity caller) {
        IssuesEntity issue = loadAccessible(issueId, caller);
        String key = issue.getProject().issueKey(issue.getIssueNumber());
        issuesRepository.delete(issue);
        log.info("Issue {} deleted by {}", key, caller.getEmail());
    }

    // ========== HELPERS ==========

    private IssuesEntity loadAccessible(UUID issueId, UsersEntity caller) {
        IssuesEntity issue = issuesRepository.findWithProjectByIssueId(issueId)
                .orElseThrow(IssueNotFoundException::new);
        requireAccess(caller, issue.getProject());
        return issue;
    }

    private void requireAccess(UsersEntity caller, ProjectsEntity project) {
        if (!accessPolicy.canAccessProject(caller, project)) {
            throw new ForbiddenOperationException("Not enough permissions to access this project");
        }
    }

    private UsersEntity requireActiveAssignee(UUID userId) {
        return usersRepository.findById(userId)
                .filter(UsersEntity::isActive)
                .orElseThrow(() -> new InvalidInputException("Assignee not found or inactive"));
    }

    private static UsersEntity activeOrNull(UsersEntity user) {
        return user != null && user.isActive() ? user : null;
    }

    private static String requireText(String value, String label, int maxLength) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidInputException(label + " must not be empty");
        }
        String text = value.trim();
        if (text.length() > maxLength) {
            throw new InvalidInputException(label + " must be at most " + maxLength + " characters");
        }
        return text;
    }

    private static <T> T requireValue(T value, String label) {
        if (value == null) {
            throw new InvalidInputException(label + " must be one of the defined values");
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
