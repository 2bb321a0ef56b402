package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Config.MembershipConfig;
import com.agile.Buro.Config.TimeConfig;
import com.agile.Buro.Models.IssueModel;
import com.agile.Buro.Models.ProjectModel;
import com.agile.Buro.dto.request.IssueCreateRequest;
import com.agile.Buro.dto.request.ProjectCreateRequest;
import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.ProjectMembersRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs issue creation against a real (H2) database with committed transactions,
 * so the project row lock and the unique number constraint are both in play.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({IssueService.class, ProjectService.class, AccessPolicy.class,
        MembershipConfig.class, TimeConfig.class, IssueNumberingConcurrencyTest.PropertiesConfig.class})
class IssueNumberingConcurrencyTest {

    @TestConfiguration
    @EnableConfigurationProperties(BuroProperties.class)
    static class PropertiesConfig {}

    @Autowired private IssueService issueService;
    @Autowired private ProjectService projectService;
    @Autowired private UsersRepository usersRepository;
    @Autowired private ProjectsRepository projectsRepository;
    @Autowired private IssuesRepository issuesRepository;
    @Autowired private ProjectMembersRepository membersRepository;

    @MockBean private NotificationDispatcher notificationDispatcher;

    private UsersEntity manager;

    @BeforeEach
    void setUp() {
        manager = usersRepository.saveAndFlush(newUser("manager1@buro.test", UserRole.MANAGER));
    }

    @AfterEach
    void cleanUp() {
        issuesRepository.deleteAllInBatch();
        membersRepository.deleteAllInBatch();
        projectsRepository.deleteAllInBatch();
        usersRepository.deleteAllInBatch();
    }

    @Test
    void demoProject_firstIssueIsDemo1InBacklog() {
        ProjectModel project = projectService.createProject(
                new ProjectCreateRequest("Demo", "demo", null, null), manager);

        IssueModel issue = issueService.createIssue(request(project.getId(), "Fix bug"), manager);

        assertThat(project.getKey()).isEqualTo("DEMO");
        assertThat(issue.getKey()).isEqualTo("DEMO-1");
        assertThat(issue.getIssueNumber()).isEqualTo(1);
        assertThat(issue.getStatus()).isEqualTo(IssueStatus.BACKLOG);
        assertThat(issue.getPriority()).isEqualTo(IssuePriority.MEDIUM);
        assertThat(issue.getType()).isEqualTo(IssueType.TASK);
        assertThat(issue.getReporter().id()).isEqualTo(manager.getUserId());
    }

    @Test
    void twoConcurrentCreations_getOneAndTwo() throws Exception {
        UUID projectId = projectService.createProject(
                new ProjectCreateRequest("Pair", "PAIR", null, null), manager).getId();

        assertThat(createConcurrently(projectId, 2)).containsExactly(1, 2);
    }

    @Test
    void manyConcurrentCreations_numbersAreDenseAndUnique() throws Exception {
        UUID projectId = projectService.createProject(
                new ProjectCreateRequest("Load", "LOAD", null, null), manager).getId();
        int n = 12;

        List<Integer> numbers = createConcurrently(projectId, n);

        assertThat(numbers).containsExactlyElementsOf(
                IntStream.rangeClosed(1, n).boxed().collect(Collectors.toList()));
        assertThat(issuesRepository.findMaxIssueNumber(projectId)).isEqualTo(n);
    }

    @Test
    void numbersAreScopedPerProject() {
        UUID first = projectService.createProject(new ProjectCreateRequest("A", "AAA", null, null), manager).getId();
        UUID second = projectService.createProject(new ProjectCreateRequest("B", "BBB", null, null), manager).getId();

        issueService.createIssue(request(first, "one"), manager);
        issueService.createIssue(request(first, "two"), manager);
        IssueModel other = issueService.createIssue(request(second, "one"), manager);

        assertThat(other.getKey()).isEqualTo("BBB-1");
    }

    @Test
    void deletedTopNumber_isNotReused() {
        UUID projectId = projectService.createProject(
                new ProjectCreateRequest("Gap", "GAP", null, null), manager).getId();
        issueService.createIssue(request(projectId, "one"), manager);
        IssueModel second = issueService.createIssue(request(projectId, "two"), manager);

        issueService.deleteIssue(second.getId(), manager);
        IssueModel third = issueService.createIssue(request(projectId, "three"), manager);

        assertThat(third.getIssueNumber()).isEqualTo(3);
    }

    private List<Integer> createConcurrently(UUID projectId, int n) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<IssueModel>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String title = "Concurrent " + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return issueService.createIssue(request(projectId, title), manager);
                }));
            }
            start.countDown();

            List<Integer> numbers = new ArrayList<>();
            for (Future<IssueModel> f : futures) {
                numbers.add(f.get(30, TimeUnit.SECONDS).getIssueNumber());
            }
            numbers.sort(Integer::compareTo);
            return numbers;
        } finally {
            pool.shutdownNow();
        }
    }

    private static IssueCreateRequest request(UUID projectId, String title) {
        IssueCreateRequest req = new IssueCreateRequest();
        req.setProjectId(projectId);
        req.setTitle(title);
        return req;
    }

    private static UsersEntity newUser(String email, UserRole role) {
        UsersEntity u = new UsersEntity();
        u.setEmail(email);
        u.setFullName("Manager One");
        u.setRole(role);
        u.setActive(true);
        return u;
    }
}
