package com.agile.Buro.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "projects")
public class ProjectsEntity {

    public static final int MAX_KEY_LENGTH = 10;
    public static final int MAX_NAME_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "name", nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    // stored upper-case, unique
    @Column(name = "project_key", nullable = false, unique = true, length = MAX_KEY_LENGTH)
    private String projectKey;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private UsersEntity owner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "default_assignee_id")
    private UsersEntity defaultAssignee;

    // last issue number handed out, only advanced under the project row lock
    @Column(name = "issue_counter", nullable = false)
    private int issueCounter = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "project", fetch = FetchType.LAZY, cascade = CascadeType.REMOVE, orphanRemoval = true)
    private List<IssuesEntity> issues = new ArrayList<>();

    @OneToMany(mappedBy = "project", fetch = FetchType.LAZY, cascade = CascadeType.REMOVE, orphanRemoval = true)
    private List<ProjectMemberEntity> members = new ArrayList<>();

    /**
     * Reserves the next issue number. Callers must hold the row lock on this project.
     *
     * @param currentMax highest number stored for the project, 0 when it has no issues
     */
    public int allocateIssueNumber(int currentMax) {
        issueCounter = Math.max(issueCounter, currentMax) + 1;
        return issueCounter;
    }

    public String issueKey(int issueNumber) {
        return issueKey(projectKey, issueNumber);
    }

    public static String issueKey(String projectKey, int issueNumber) {
        return projectKey + "-" + issueNumber;
    }

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getUserId().equals(userId);
    }
}
