package com.faqchat.model;

import java.time.Instant;

/**
 * Anything the core hands to the outbound notification sink.
 */
public interface NotificationEvent {

    String conversationId();

    Instant timestamp();

    /** Short label used by channels for routing and log lines. */
    String eventType();
}
