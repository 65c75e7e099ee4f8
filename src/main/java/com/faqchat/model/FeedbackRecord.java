package com.faqchat.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One feedback submission. Every submission is forwarded independently; none overwrites another.
 */
@Builder
public record FeedbackRecord(
        String conversationId,
        Rating rating,
        String comment,
        Instant timestamp,
        ConversationState state,
        String category,
        Integer interactionCount
) implements NotificationEvent {

    @Override
    public String eventType() {
        return "feedback_" + rating.code();
    }
}
