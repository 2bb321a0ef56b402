package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.IssueModel;
import com.agile.Buro.Models.KanbanBoardModel;
import com.agile.Buro.Models.PageModel;
import com.agile.Buro.dto.IssueFilter;
import com.agile.Buro.dto.IssueUpdate;
import com.agile.Buro.dto.NotificationRequest;
import com.agile.Buro.dto.request.IssueCreateRequest;
import com.agile.Buro.entity.*;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.IssueNotFoundException;
import com.agile.Buro.exception.ProjectNotFoundException;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.agile.Buro.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IssueServiceTest {

    @Mock
    private IssuesRepository issuesRepository;
    @Mock
    private ProjectsRepository projectsRepository;
    @Mock
    private UsersRepository usersRepository;
    @Mock
    private ProjectMembershipLookup membership;
    @Mock
    private ProjectService projectService;
    @Mock
    private NotificationDispatcher notifications;

    private IssueService issueService;

    private UsersEntity manager;
    private UsersEntity developer;
    private ProjectsEntity project;

    @BeforeEach
    void setUp() {
        issueService = new IssueService(issuesRepository, projectsRepository, usersRepository,
                new AccessPolicy(membership), projectService, notifications, new BuroProperties());
        manager = user(UserRole.MANAGER);
        developer = user(UserRole.DEVELOPER);
        project = project("DEMO", manager);
    }

    private IssueCreateRequest createRequest(String title) {
        IssueCreateRequest req = new IssueCreateRequest();
        req.setTitle(title);
        req.setProjectId(project.getProjectId());
        return req;
    }

    private void stubSaves() {
        when(issuesRepository.saveAndFlush(any(IssuesEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ========== CREATE ==========

    @Test
    void createIssue_firstIssue_getsNumberOneAndDefaults() {
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));
        when(issuesRepository.findMaxIssueNumber(project.getProjectId())).thenReturn(0);
        stubSaves();

        IssueModel created = issueService.createIssue(createRequest("  Fix bug  "), manager);

        assertThat(created.getKey()).isEqualTo("DEMO-1");
        assertThat(created.getTitle()).isEqualTo("Fix bug");
        assertThat(created.getStatus()).isEqualTo(IssueStatus.BACKLOG);
        assertThat(created.getPriority()).isEqualTo(IssuePriority.MEDIUM);
        assertThat(created.getType()).isEqualTo(IssueType.TASK);
        assertThat(created.getReporter().id()).isEqualTo(manager.getUserId());
        assertThat(created.getAssignee()).isNull();
        verifyNoInteractions(notifications);
    }

    @Test
    void createIssue_afterDeletes_neverReusesNumbers() {
        project.setIssueCounter(5);
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));
        when(issuesRepository.findMaxIssueNumber(project.getProjectId())).thenReturn(3);
        stubSaves();

        IssueModel created = issueService.createIssue(createRequest("Next"), manager);

        assertThat(created.getIssueNumber()).isEqualTo(6);
        assertThat(project.getIssueCounter()).isEqualTo(6);
    }

    @Test
    void createIssue_unknownProject_notFound() {
        when(projectsRepository.findByIdForUpdate(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> issueService.createIssue(createRequest("x"), manager))
                .isInstanceOf(ProjectNotFoundException.class);
    }

    @Test
    void createIssue_nonMember_forbidden() {
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));
        when(membership.isMember(developer.getUserId(), project.getProjectId())).thenReturn(false);

        assertThatThrownBy(() -> issueService.createIssue(createRequest("x"), developer))
                .isInstanceOf(ForbiddenOperationException.class);
        verify(issuesRepository, never()).saveAndFlush(any());
    }

    @Test
    void createIssue_inactiveAssignee_invalidInput() {
        developer.setActive(false);
        IssueCreateRequest req = createRequest("x");
        req.setAssigneeId(developer.getUserId());
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));

        assertThatThrownBy(() -> issueService.createIssue(req, manager))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void createIssue_blankTitle_invalidInput() {
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));

        assertThatThrownBy(() -> issueService.createIssue(createRequest("   "), manager))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void createIssue_titleOverColumnLength_invalidInput() {
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));

        assertThatThrownBy(() -> issueService.createIssue(
                createRequest("x".repeat(IssuesEntity.MAX_TITLE_LENGTH + 1)), manager))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("at most " + IssuesEntity.MAX_TITLE_LENGTH);
        verify(issuesRepository, never()).saveAndFlush(any());
    }

    @Test
    void createIssue_defaultAssignee_isUsedAndNotified() {
        project.setDefaultAssignee(developer);
        when(projectsRepository.findByIdForUpdate(project.getProjectId())).thenReturn(Optional.of(project));
        when(issuesRepository.findMaxIssueNumber(project.getProjectId())).thenReturn(0);
        stubSaves();

        IssueModel created = issueService.createIssue(createRequest("Assigned"), manager);

        assertThat(created.getAssignee().id()).isEqualTo(developer.getUserId());
        ArgumentCaptor<NotificationRequest> sent = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(notifications).dispatch(sent.capture());
        assertThat(sent.getValue().recipientId()).isEqualTo(developer.getUserId());
        assertThat(sent.getValue().type()).isEqualTo(NotiType.ISSUE_ASSIGNED);
        assertThat(sent.getValue().subject()).isEqualTo("[DEMO-1] Issue assigned to you");
    }

    // ========== UPDATE ==========

    @Test
    void updateIssue_sameTitleTwice_isIdempotent() {
        IssuesEntity issue = issue(project, 1, manager);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();
        IssueUpdate update = IssueUpdate.builder().title("X").build();

        IssueModel first = issueService.updateIssue(issue.getIssueId(), update, manager);
        IssueModel second = issueService.updateIssue(issue.getIssueId(), update, manager);

        assertThat(second).usingRecursiveComparison().isEqualTo(first);
        assertThat(second.getTitle()).isEqualTo("X");
    }

    @Test
    void updateIssue_onlyPresentFieldsChange() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setDescription("keep me");
        issue.setPriority(IssuePriority.LOW);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();

        IssueModel updated = issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().priority(IssuePriority.HIGHEST).build(), manager);

        assertThat(updated.getPriority()).isEqualTo(IssuePriority.HIGHEST);
        assertThat(updated.getDescription()).isEqualTo("keep me");
        assertThat(updated.getTitle()).isEqualTo("Issue 1");
    }

    @Test
    void updateIssue_blankTitle_invalidInput() {
        IssuesEntity issue = issue(project, 1, manager);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));

        assertThatThrownBy(() -> issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().title("  ").build(), manager))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void updateIssue_titleOverColumnLength_invalidInputAndUnchanged() {
        IssuesEntity issue = issue(project, 1, manager);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));

        assertThatThrownBy(() -> issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().title("x".repeat(600)).build(), manager))
                .isInstanceOf(InvalidInputException.class);
        assertThat(issue.getTitle()).isNotEqualTo("x".repeat(600));
        verify(issuesRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateIssue_titleAtColumnLength_isAccepted() {
        IssuesEntity issue = issue(project, 1, manager);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();
        String longest = "x".repeat(IssuesEntity.MAX_TITLE_LENGTH);

        IssueModel updated = issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().title(longest).build(), manager);

        assertThat(updated.getTitle()).isEqualTo(longest);
    }

    @Test
    void updateIssue_explicitNullAssignee_unassigns() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setAssignee(developer);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();

        IssueModel updated = issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().assignee(null).build(), manager);

        assertThat(updated.getAssignee()).isNull();
        verifyNoInteractions(notifications);
    }

    @Test
    void updateIssue_sameAssigneeAgain_doesNotNotify() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setAssignee(developer);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));
        stubSaves();

        issueService.updateIssue(issue.getIssueId(),
                IssueUpdate.builder().assignee(developer.getUserId()).build(), manager);

        verifyNoInteractions(notifications);
    }

    // ========== STATUS ==========

    @Test
    void transitionStatus_backwardMove_isAllowed() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setStatus(IssueStatus.DONE);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();

        IssueModel moved = issueService.transitionStatus(issue.getIssueId(), IssueStatus.TO_DO, manager);

        assertThat(moved.getStatus()).isEqualTo(IssueStatus.TO_DO);
    }

    @Test
    void transitionStatus_sameStatus_isNoOp() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setStatus(IssueStatus.IN_PROGRESS);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));

        IssueModel same = issueService.transitionStatus(issue.getIssueId(), IssueStatus.IN_PROGRESS, manager);

        assertThat(same.getStatus()).isEqualTo(IssueStatus.IN_PROGRESS);
        verify(issuesRepository, never()).saveAndFlush(any());
        verifyNoInteractions(notifications);
    }

    @Test
    void transitionStatus_notifiesReporterAndAssigneeButNotActor() {
        IssuesEntity issue = issue(project, 1, developer);
        UsersEntity assignee = user(UserRole.DEVELOPER);
        issue.setAssignee(assignee);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();

        issueService.transitionStatus(issue.getIssueId(), IssueStatus.IN_PROGRESS, manager);

        ArgumentCaptor<NotificationRequest> sent = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(notifications, times(2)).dispatch(sent.capture());
        assertThat(sent.getAllValues()).extracting(NotificationRequest::recipientId)
                .containsExactlyInAnyOrder(developer.getUserId(), assignee.getUserId());
        assertThat(sent.getAllValues()).allSatisfy(r ->
                assertThat(r.subject()).isEqualTo("[DEMO-1] Status changed to in_progress"));
    }

    @Test
    void transitionStatus_byReporter_notifiesOnlyAssignee() {
        IssuesEntity issue = issue(project, 1, manager);
        issue.setAssignee(developer);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId())).thenReturn(Optional.of(issue));
        stubSaves();

        issueService.transitionStatus(issue.getIssueId(), IssueStatus.DONE, manager);

        ArgumentCaptor<NotificationRequest> sent = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(notifications).dispatch(sent.capture());
        assertThat(sent.getValue().recipientId()).isEqualTo(developer.getUserId());
    }

    @Test
    void transitionStatus_nullStatus_invalidInput() {
        assertThatThrownBy(() -> issueService.transitionStatus(UUID.randomUUID(), null, manager))
                .isInstanceOf(InvalidInputException.class);
    }

    // ========== DELETE / LIST ==========

    @Test
    void deleteIssue_thenFetch_notFound() {
        IssuesEntity issue = issue(project, 1, manager);
        when(issuesRepository.findWithProjectByIssueId(issue.getIssueId()))
                .thenReturn(Optional.of(issue))
                .thenReturn(Optional.empty());

        issueService.deleteIssue(issue.getIssueId(), manager);

        verify(issuesRepository).delete(issue);
        assertThatThrownBy(() -> issueService.getIssue(issue.getIssueId(), manager))
                .isInstanceOf(IssueNotFoundException.class);
    }

    @Test
    void getIssueByKey_matchesKeyCaseInsensitively() {
        IssuesEntity issue = issue(project, 7, manager);
        when(projectsRepository.findByProjectKey("DEMO")).thenReturn(Optional.of(project));
        when(issuesRepository.findByProject_ProjectIdAndIssueNumber(project.getProjectId(), 7))
                .thenReturn(Optional.of(issue));

        IssueModel found = issueService.getIssueByKey("demo", 7, manager);

        assertThat(found.getKey()).isEqualTo("DEMO-7");
    }

    @Test
    void listIssues_negativeSkip_invalidInput() {
        assertThatThrownBy(() -> issueService.listIssues(IssueFilter.none(), manager, -1, 10))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void kanbanBoard_groupsByStatusInWorkflowOrder() {
        IssuesEntity a = issue(project, 1, manager);
        IssuesEntity b = issue(project, 2, manager);
        b.setStatus(IssueStatus.DONE);
        when(projectsRepository.findById(project.getProjectId())).thenReturn(Optional.of(project));
        when(issuesRepository.findByProject_ProjectIdOrderByUpdatedAtDesc(any(), any())).thenReturn(List.of(a, b));

        KanbanBoardModel board = issueService.kanbanBoard(project.getProjectId(), manager);

        assertThat(board.getColumns()).extracting(KanbanBoardModel.Column::status)
                .containsExactly(IssueStatus.BACKLOG, IssueStatus.TO_DO, IssueStatus.IN_PROGRESS, IssueStatus.DONE);
        assertThat(board.getColumns()).extracting(KanbanBoardModel.Column::count).containsExactly(1, 0, 0, 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listIssues_withoutProject_isRestrictedToAccessibleProjects() {
        Set<UUID> visible = Set.of(project.getProjectId());
        when(projectService.accessibleProjectIds(developer)).thenReturn(Optional.of(visible));
        IssuesEntity own = issue(project, 1, manager);
        Page<IssuesEntity> page = new PageImpl<>(List.of(own));
        when(issuesRepository.findAll(any(Specification.class), any(Pageable.class))).thenReturn(page);

        PageModel<IssueModel> result = issueService.listIssues(IssueFilter.none(), developer, 0, 10);

        assertThat(result.getItems()).extracting(IssueModel::getKey).containsExactly("DEMO-1");

        ArgumentCaptor<Specification<IssuesEntity>> spec = ArgumentCaptor.forClass(Specification.class);
        verify(issuesRepository).findAll(spec.capture(), any(Pageable.class));
        Root<IssuesEntity> root = mock(Root.class);
        Path<Object> projectPath = mock(Path.class);
        Path<Object> projectIdPath = mock(Path.class);
        when(root.get("project")).thenReturn(projectPath);
        when(projectPath.get("projectId")).thenReturn(projectIdPath);

        spec.getValue().toPredicate(root, mock(CriteriaQuery.class), mock(CriteriaBuilder.class));

        verify(projectIdPath).in(visible);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listIssues_withoutProject_unrestrictedWhenNothingLimitsCaller() {
        when(projectService.accessibleProjectIds(manager)).thenReturn(Optional.empty());
        when(issuesRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        issueService.listIssues(IssueFilter.none(), manager, 0, 10);

        ArgumentCaptor<Specification<IssuesEntity>> spec = ArgumentCaptor.forClass(Specification.class);
        verify(issuesRepository).findAll(spec.capture(), any(Pageable.class));
        Root<IssuesEntity> root = mock(Root.class);

        spec.getValue().toPredicate(root, mock(CriteriaQuery.class), mock(CriteriaBuilder.class));

        verifyNoInteractions(root);
    }
}
