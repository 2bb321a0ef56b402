package com.agile.Buro.Service;

import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import org.springframework.stereotype.Component;

/**
 * Permission predicates over users and projects. Nothing here writes; the only
 * lookup is the injected {@link ProjectMembershipLookup}.
 */
@Component
public class AccessPolicy {

    private final ProjectMembershipLookup membership;

    public AccessPolicy(ProjectMembershipLookup membership) {
        this.membership = membership;
    }

    /** Admin, or the manager who owns the project. */
    public boolean canManageProject(UsersEntity user, ProjectsEntity project) {
        if (user == null || project == null) return false;
        if (user.isAdmin()) return true;
        return user.isManager() && project.isOwnedBy(user.getUserId());
    }

    /** Active admin, owner or member. */
    public boolean canAccessProject(UsersEntity user, ProjectsEntity project) {
        if (user == null || project == null || !user.isActive()) return false;
        if (user.isAdmin() || project.isOwnedBy(user.getUserId())) return true;
        return membership.isMember(user.getUserId(), project.getProjectId());
    }

    public boolean canCreateProject(UsersEntity user) {
        return user != null && (user.isAdmin() || user.isManager());
    }

    public boolean canListAllUsers(UsersEntity user) {
        return user != null && (user.isAdmin() || user.isManager());
    }

    /** Admins only, and never themselves. */
    public boolean canDeactivate(UsersEntity user, UsersEntity target) {
        if (user == null || target == null) return false;
        return user.isAdmin() && !user.getUserId().equals(target.getUserId());
    }

    public boolean canViewProjectStats(UsersEntity user, ProjectsEntity project) {
        if (user == null || project == null) return false;
        return user.isAdmin() || user.isManager() || project.isOwnedBy(user.getUserId());
    }

    public boolean canViewProjectAnalytics(UsersEntity user, ProjectsEntity project) {
        if (user == null || project == null) return false;
        return user.isAdmin() || project.isOwnedBy(user.getUserId());
    }

    public boolean canViewUser(UsersEntity user, UsersEntity target) {
        if (user == null || target == null) return false;
        return isSelf(user, target) || canListAllUsers(user);
    }

    /** Self, admin, or a manager editing a developer. */
    public boolean canEditUser(UsersEntity user, UsersEntity target) {
        if (user == null || target == null) return false;
        if (isSelf(user, target) || user.isAdmin()) return true;
        return user.isManager() && target.getRole() == UserRole.DEVELOPER;
    }

    public boolean canChangeRole(UsersEntity user) {
        return user != null && user.isAdmin();
    }

    private static boolean isSelf(UsersEntity user, UsersEntity target) {
        return user.getUserId() != null && user.getUserId().equals(target.getUserId());
    }
}
