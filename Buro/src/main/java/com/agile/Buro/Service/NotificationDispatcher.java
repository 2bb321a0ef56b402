package com.agile.Buro.Service;

import com.agile.Buro.dto.NotificationRequest;

/**
 * Outbound side of notifications. Implementations only enqueue; delivery happens
 * elsewhere and never reports back to the caller.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationRequest request);
}
