package com.agile.Buro.Service;

import com.agile.Buro.Config.AsyncConfig;
import com.agile.Buro.dto.NotificationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers queued notifications on the notification executor: an inbox row first,
 * then an e-mail when mail is enabled. Failures stay here.
 */
@Slf4j
@Component
public class NotificationWorker {

    private final NotificationService notificationService;
    private final EmailService emailService;

    public NotificationWorker(NotificationService notificationService, EmailService emailService) {
        this.notificationService = notificationService;
        this.emailService = emailService;
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(NotificationRequest request) {
        deliver(request);
    }

    void deliver(NotificationRequest request) {
        try {
            notificationService.store(request);
        } catch (RuntimeException e) {
            log.warn("Could not store {} notification for {}: {}", request.type(), request.recipientId(), e.getMessage());
        }

        if (!emailService.isEnabled() || request.recipientEmail() == null) {
            log.debug("Mail disabled, skipped e-mail for {} notification", request.type());
            return;
        }
        try {
            switch (request.type()) {
                case WELCOME -> emailService.sendWelcome(request.recipientEmail(), request.recipientName());
                default -> emailService.sendNotification(request.recipientEmail(), request.subject(), request.body());
            }
            log.info("Sent {} e-mail to {}", request.type(), request.recipientEmail());
        } catch (RuntimeException e) {
            log.warn("Failed to send {} e-mail to {}: {}", request.type(), request.recipientEmail(), e.getMessage());
        }
    }
}
