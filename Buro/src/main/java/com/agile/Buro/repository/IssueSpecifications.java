package com.agile.Buro.repository;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;
import com.agile.Buro.entity.IssuesEntity;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;
import java.util.UUID;

/**
 * Equality predicates for issue listings. A {@code null} argument means "no filter".
 */
public final class IssueSpecifications {

    private IssueSpecifications() {}

    public static Specification<IssuesEntity> inProject(UUID projectId) {
        return (root, q, cb) -> projectId == null ? null
                : cb.equal(root.get("project").get("projectId"), projectId);
    }

    public static Specification<IssuesEntity> inProjects(Collection<UUID> projectIds) {
        return (root, q, cb) -> {
            if (projectIds == null) return null;
            if (projectIds.isEmpty()) return cb.isNull(root.get("issueId"));
            return root.get("project").get("projectId").in(projectIds);
        };
    }

    public static Specification<IssuesEntity> assignedTo(UUID assigneeId) {
        return (root, q, cb) -> assigneeId == null ? null
                : cb.equal(root.get("assignee").get("userId"), assigneeId);
    }

    public static Specification<IssuesEntity> reportedBy(UUID reporterId) {
        return (root, q, cb) -> reporterId == null ? null
                : cb.equal(root.get("reporter").get("userId"), reporterId);
    }

    public static Specification<IssuesEntity> hasStatus(IssueStatus status) {
        return (root, q, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<IssuesEntity> hasType(IssueType type) {
        return (root, q, cb) -> type == null ? null : cb.equal(root.get("type"), type);
    }

    public static Specification<IssuesEntity> hasPriority(IssuePriority priority) {
        return (root, q, cb) -> priority == null ? null : cb.equal(root.get("priority"), priority);
    }
}
