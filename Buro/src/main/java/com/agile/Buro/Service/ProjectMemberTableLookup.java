package com.agile.Buro.Service;

import com.agile.Buro.repository.ProjectMembersRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public class ProjectMemberTableLookup implements ProjectMembershipLookup {

    private final ProjectMembersRepository membersRepository;

    public ProjectMemberTableLookup(ProjectMembersRepository membersRepository) {
        this.membersRepository = membersRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isMember(UUID userId, UUID projectId) {
        if (userId == null || projectId == null) return false;
        return membersRepository.existsByProject_ProjectIdAndUser_UserId(projectId, userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Set<UUID>> memberProjectIds(UUID userId) {
        return Optional.of(new HashSet<>(membersRepository.findProjectIdsByUserId(userId)));
    }
}
