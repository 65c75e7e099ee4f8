package com.faqchat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Server-owned record of one visitor's progress. Only the session store and the state machine
 * (under the store's per-conversation lock) mutate it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession {

    private String conversationId;

    @Builder.Default
    private ConversationState state = ConversationState.INITIAL;

    private String selectedCategory;

    private Integer selectedFaqId;

    private int interactionCount;

    private String inquiryId;

    private Instant createdAt;

    private Instant lastActivityAt;

    public static ConversationSession fresh(String conversationId, Instant now) {
        return ConversationSession.builder()
                .conversationId(conversationId)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
        this.interactionCount++;
    }

    public ConversationSession copy() {
        return toBuilder().build();
    }
}
