package com.agile.Buro.repository;

import com.agile.Buro.entity.ProjectMemberEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectMembersRepository extends JpaRepository<ProjectMemberEntity, UUID> {

    boolean existsByProject_ProjectIdAndUser_UserId(UUID projectId, UUID userId);

    Optional<ProjectMemberEntity> findByProject_ProjectIdAndUser_UserId(UUID projectId, UUID userId);

    @EntityGraph(attributePaths = {"user"})
    List<ProjectMemberEntity> findByProject_ProjectIdOrderByAddedAtAsc(UUID projectId);

    @Query("select m.project.projectId from ProjectMemberEntity m where m.user.userId = :userId")
    List<UUID> findProjectIdsByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from ProjectMemberEntity m where m.user.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
