package com.agile.Buro.Service;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Answers which projects a user belongs to. Owners and admins are handled by
 * {@link AccessPolicy}; this only covers explicit membership.
 */
public interface ProjectMembershipLookup {

    boolean isMember(UUID userId, UUID projectId);

    /**
     * Ids of the projects the user was added to, or empty when membership does not
     * restrict access at all.
     */
    Optional<Set<UUID>> memberProjectIds(UUID userId);
}
