package com.faqchat.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Summary of a visitor interaction (search, FAQ pick, ...) or an operational change.
 */
@Builder
public record InteractionEvent(
        String conversationId,
        Kind kind,
        String question,
        String answerPreview,
        Double confidence,
        String category,
        Instant timestamp
) implements NotificationEvent {

    public enum Kind {
        SEARCH,
        CATEGORY_SELECTION,
        FAQ_SELECTION,
        DATASET_RELOAD
    }

    @Override
    public String eventType() {
        return kind.name().toLowerCase(java.util.Locale.ROOT);
    }
}
