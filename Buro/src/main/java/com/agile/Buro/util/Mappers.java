package com.agile.Buro.util;

import com.agile.Buro.Models.IssueModel;
import com.agile.Buro.Models.NotiModel;
import com.agile.Buro.Models.ProjectModel;
import com.agile.Buro.Models.UserModel;
import com.agile.Buro.Models.UserRef;
import com.agile.Buro.entity.IssuesEntity;
import com.agile.Buro.entity.NotiEntity;
import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UsersEntity;

/**
 * Entity to response model conversion. Callers must have fetched the associations
 * they pass in (issue with project, project with owner); nothing here relies on a
 * lazy load outside the query that produced the entity.
 */
public final class Mappers {

    private Mappers() {}

    public static UserModel toUserModel(UsersEntity u) {
        UserModel m = new UserModel();
        m.setId(u.getUserId());
        m.setEmail(u.getEmail());
        m.setFullName(u.getFullName());
        m.setAvatarUrl(u.getAvatarUrl());
        m.setRole(u.getRole());
        m.setActive(u.isActive());
        m.setCreatedAt(u.getCreatedAt());
        return m;
    }

    public static UserRef toUserRef(UsersEntity u) {
        if (u == null) return null;
        return new UserRef(u.getUserId(), u.getFullName(), u.getEmail());
    }

    public static ProjectModel toProjectModel(ProjectsEntity p) {
        ProjectModel m = new ProjectModel();
        m.setId(p.getProjectId());
        m.setName(p.getName());
        m.setKey(p.getProjectKey());
        m.setDescription(p.getDescription());
        m.setOwner(toUserRef(p.getOwner()));
        m.setDefaultAssignee(toUserRef(p.getDefaultAssignee()));
        m.setCreatedAt(p.getCreatedAt());
        m.setUpdatedAt(p.getUpdatedAt());
        return m;
    }

    public static IssueModel toIssueModel(IssuesEntity i) {
        ProjectsEntity project = i.getProject();
        IssueModel m = new IssueModel();
        m.setId(i.getIssueId());
        m.setKey(project.issueKey(i.getIssueNumber()));
        m.setIssueNumber(i.getIssueNumber());
        m.setProjectId(project.getProjectId());
        m.setProjectKey(project.getProjectKey());
        m.setTitle(i.getTitle());
        m.setDescription(i.getDescription());
        m.setType(i.getType());
        m.setStatus(i.getStatus());
        m.setPriority(i.getPriority());
        m.setReporter(toUserRef(i.getReporter()));
        m.setAssignee(toUserRef(i.getAssignee()));
        m.setCreatedAt(i.getCreatedAt());
        m.setUpdatedAt(i.getUpdatedAt());
        return m;
    }

    public static NotiModel toNotiModel(NotiEntity n) {
        NotiModel m = new NotiModel();
        m.setNotiId(n.getNotiId());
        m.setTypeNoti(n.getTypeNoti());
        m.setSubject(n.getSubject());
        m.setMessage(n.getMessage());
        m.setIssueKey(n.getIssueKey());
        m.setRead(n.isRead());
        m.setCreatedAt(n.getCreatedAt());
        return m;
    }
}
