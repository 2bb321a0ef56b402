package com.agile.Buro.Service;

import com.agile.Buro.dto.NotificationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Publishes requests as application events for {@link NotificationWorker}, which
 * picks them up once the surrounding transaction has committed.
 */
@Slf4j
@Service
public class EventNotificationDispatcher implements NotificationDispatcher {

    private final ApplicationEventPublisher publisher;

    public EventNotificationDispatcher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void dispatch(NotificationRequest request) {
        if (request == null || request.recipientId() == null) {
            return;
        }
        log.debug("Queued {} notification for {}", request.type(), request.recipientId());
        publisher.publishEvent(request);
    }
}
