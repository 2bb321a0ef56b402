package com.agile.Buro.Service;

import com.agile.Buro.dto.NotificationRequest;
import com.agile.Buro.entity.NotiType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationWorkerTest {

    @Mock private NotificationService notificationService;
    @Mock private EmailService emailService;

    @InjectMocks private NotificationWorker worker;

    private final NotificationRequest assigned = new NotificationRequest(UUID.randomUUID(), "dev@buro.test", "Dev",
            NotiType.ISSUE_ASSIGNED, "[DEMO-1] Issue assigned to you", "body", "DEMO-1");

    @Test
    void storesInboxRowAndMails_whenMailEnabled() {
        when(notificationService.store(assigned)).thenReturn(Optional.empty());
        when(emailService.isEnabled()).thenReturn(true);

        worker.deliver(assigned);

        verify(emailService).sendNotification("dev@buro.test", "[DEMO-1] Issue assigned to you", "body");
    }

    @Test
    void welcome_usesWelcomeTemplate() {
        NotificationRequest welcome = new NotificationRequest(UUID.randomUUID(), "new@buro.test", "New",
                NotiType.WELCOME, "Welcome to Buro", "hi", null);
        when(emailService.isEnabled()).thenReturn(true);

        worker.deliver(welcome);

        verify(emailService).sendWelcome("new@buro.test", "New");
        verify(emailService, never()).sendNotification(anyString(), anyString(), anyString());
    }

    @Test
    void mailDisabled_onlyStores() {
        when(emailService.isEnabled()).thenReturn(false);

        worker.deliver(assigned);

        verify(notificationService).store(assigned);
        verify(emailService, never()).sendNotification(anyString(), anyString(), anyString());
    }

    @Test
    void failures_doNotEscapeTheWorker() {
        when(notificationService.store(any())).thenThrow(new IllegalStateException("db down"));
        when(emailService.isEnabled()).thenReturn(true);
        doThrow(new IllegalStateException("smtp down")).when(emailService).sendNotification(anyString(), anyString(), anyString());

        worker.deliver(assigned);

        verify(emailService).sendNotification(anyString(), anyString(), anyString());
    }
}
