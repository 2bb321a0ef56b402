package com.agile.Buro.dto;

import com.agile.Buro.entity.NotiType;

import java.util.UUID;

/**
 * One outbound message. Published as an application event and delivered after commit.
 */
public record NotificationRequest(
        UUID recipientId,
        String recipientEmail,
        String recipientName,
        NotiType type,
        String subject,
        String body,
        String issueKey
) {}
