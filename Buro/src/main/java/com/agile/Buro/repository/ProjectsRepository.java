package com.agile.Buro.repository;

import com.agile.Buro.entity.ProjectsEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectsRepository extends JpaRepository<ProjectsEntity, UUID> {

    /** Row lock that serializes issue-number allocation per project. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ProjectsEntity p where p.projectId = :projectId")
    Optional<ProjectsEntity> findByIdForUpdate(@Param("projectId") UUID projectId);

    @EntityGraph(attributePaths = {"owner", "defaultAssignee"})
    Optional<ProjectsEntity> findWithOwnerByProjectId(UUID projectId);

    @EntityGraph(attributePaths = {"owner", "defaultAssignee"})
    Optional<ProjectsEntity> findByProjectKey(String projectKey);

    boolean existsByProjectKey(String projectKey);

    boolean existsByProjectKeyAndProjectIdNot(String projectKey, UUID projectId);

    @EntityGraph(attributePaths = {"owner", "defaultAssignee"})
    List<ProjectsEntity> findAllByOrderByCreatedAtDesc();

    @EntityGraph(attributePaths = {"owner", "defaultAssignee"})
    List<ProjectsEntity> findByOwner_UserIdOrderByCreatedAtDesc(UUID ownerId);

    @EntityGraph(attributePaths = {"owner", "defaultAssignee"})
    @Query("""
            select distinct p from ProjectsEntity p
            left join p.members m
            where p.owner.userId = :userId or m.user.userId = :userId
            order by p.createdAt desc
            """)
    List<ProjectsEntity> findAccessibleByUserId(@Param("userId") UUID userId);

    List<ProjectsEntity> findByOwner_UserId(UUID ownerId);

    @Modifying
    @Query("update ProjectsEntity p set p.defaultAssignee = null where p.defaultAssignee.userId = :userId")
    int clearDefaultAssignee(@Param("userId") UUID userId);
}
