package com.agile.Buro.repository;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssuesEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IssuesRepository extends JpaRepository<IssuesEntity, UUID>, JpaSpecificationExecutor<IssuesEntity> {

    interface StatusCount {
        IssueStatus getStatus();
        long getTotal();
    }

    interface IssueAge {
        IssueStatus getStatus();
        LocalDateTime getUpdatedAt();
        String getProjectKey();
        int getIssueNumber();
        String getTitle();
        /** null when unassigned */
        String getAssigneeName();
    }

    interface AssigneeLoad {
        UUID getAssigneeId();
        IssuePriority getPriority();
        long getTotal();
    }

    /* ---------- single issue, project fetched for the display key ---------- */

    @EntityGraph(attributePaths = {"project", "reporter", "assignee"})
    Optional<IssuesEntity> findWithProjectByIssueId(UUID issueId);

    @EntityGraph(attributePaths = {"project", "reporter", "assignee"})
    Optional<IssuesEntity> findByProject_ProjectIdAndIssueNumber(UUID projectId, int issueNumber);

    @Query("select coalesce(max(i.issueNumber), 0) from IssuesEntity i where i.project.projectId = :projectId")
    int findMaxIssueNumber(@Param("projectId") UUID projectId);

    /* ---------- listings ---------- */

    @Override
    @EntityGraph(attributePaths = {"project", "reporter", "assignee"})
    Page<IssuesEntity> findAll(Specification<IssuesEntity> spec, Pageable pageable);

    @EntityGraph(attributePaths = {"project", "reporter", "assignee"})
    List<IssuesEntity> findByProject_ProjectIdOrderByUpdatedAtDesc(UUID projectId, Pageable pageable);

    /* ---------- aggregates ---------- */

    @Query("""
            select i.status as status, count(i) as total
            from IssuesEntity i
            where i.project.projectId = :projectId
            group by i.status
            """)
    List<StatusCount> countByStatus(@Param("projectId") UUID projectId);

    long countByProject_ProjectIdAndStatusAndUpdatedAtGreaterThanEqual(UUID projectId,
                                                                       IssueStatus status,
                                                                       LocalDateTime since);

    long countByAssignee_UserIdAndStatusAndUpdatedAtGreaterThanEqual(UUID assigneeId,
                                                                     IssueStatus status,
                                                                     LocalDateTime since);

    long countByAssignee_UserIdAndProject_ProjectIdAndStatusAndUpdatedAtGreaterThanEqual(UUID assigneeId,
                                                                                         UUID projectId,
                                                                                         IssueStatus status,
                                                                                         LocalDateTime since);

    @Query("""
            select i.status as status, i.updatedAt as updatedAt,
                   p.projectKey as projectKey, i.issueNumber as issueNumber,
                   i.title as title, a.fullName as assigneeName
            from IssuesEntity i
            join i.project p
            left join i.assignee a
            where p.projectId in :projectIds
            order by i.updatedAt desc
            """)
    List<IssueAge> findAgesByProjectIds(@Param("projectIds") Collection<UUID> projectIds);

    @Query("""
            select i.assignee.userId as assigneeId, i.priority as priority, count(i) as total
            from IssuesEntity i
            where i.assignee is not null and i.status <> :excluded
            group by i.assignee.userId, i.priority
            """)
    List<AssigneeLoad> sumWorkload(@Param("excluded") IssueStatus excluded);

    @Query("""
            select i.assignee.userId as assigneeId, i.priority as priority, count(i) as total
            from IssuesEntity i
            where i.assignee is not null and i.status <> :excluded
              and i.project.projectId in :projectIds
            group by i.assignee.userId, i.priority
            """)
    List<AssigneeLoad> sumWorkloadInProjects(@Param("excluded") IssueStatus excluded,
                                             @Param("projectIds") Collection<UUID> projectIds);

    /* ---------- user removal ---------- */

    @Modifying
    @Query("delete from IssuesEntity i where i.reporter.userId = :userId or i.assignee.userId = :userId")
    int deleteByReporterOrAssignee(@Param("userId") UUID userId);
}
