package com.agile.Buro.Service;

import com.agile.Buro.dto.NotificationRequest;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssuesEntity;
import com.agile.Buro.entity.NotiType;
import com.agile.Buro.entity.UsersEntity;

/**
 * Builds the notification requests the services hand to {@link NotificationDispatcher}.
 * The issue passed in must have its project loaded.
 */
final class NotificationMessages {

    private NotificationMessages() {}

    static NotificationRequest issueAssigned(IssuesEntity issue, UsersEntity assignee, UsersEntity actor) {
        String key = issue.getProject().issueKey(issue.getIssueNumber());
        String subject = "[" + key + "] Issue assigned to you";
        String body = """
                Hi %s,

                %s assigned you the %s "%s" (priority %s).
                Current status: %s."""
                .formatted(assignee.getFullName(), actorName(actor), issue.getType().value(),
                        issue.getTitle(), issue.getPriority().value(), issue.getStatus().value());
        return new NotificationRequest(assignee.getUserId(), assignee.getEmail(), assignee.getFullName(),
                NotiType.ISSUE_ASSIGNED, subject, body, key);
    }

    static NotificationRequest statusChanged(IssuesEntity issue, UsersEntity recipient, UsersEntity actor,
                                             IssueStatus from, IssueStatus to) {
        String key = issue.getProject().issueKey(issue.getIssueNumber());
        String subject = "[" + key + "] Status changed to " + to.value();
        String body = """
                Hi %s,

                %s moved "%s" from %s to %s."""
                .formatted(recipient.getFullName(), actorName(actor), issue.getTitle(), from.value(), to.value());
        return new NotificationRequest(recipient.getUserId(), recipient.getEmail(), recipient.getFullName(),
                NotiType.STATUS_CHANGED, subject, body, key);
    }

    static NotificationRequest welcome(UsersEntity user) {
        String body = "Hi " + user.getFullName() + ", your Buro account is ready.";
        return new NotificationRequest(user.getUserId(), user.getEmail(), user.getFullName(),
                NotiType.WELCOME, "Welcome to Buro", body, null);
    }

    private static String actorName(UsersEntity actor) {
        return actor != null ? actor.getFullName() : "Someone";
    }
}
