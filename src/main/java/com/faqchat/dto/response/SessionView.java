package com.faqchat.dto.response;

import com.faqchat.model.ConversationSession;
import com.faqchat.model.ConversationState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionView {

    private String conversationId;

    private ConversationState state;

    private String selectedCategory;

    private Integer selectedFaqId;

    private int interactionCount;

    private String inquiryId;

    private Instant createdAt;

    private Instant lastActivityAt;

    public static SessionView of(ConversationSession session) {
        return SessionView.builder()
                .conversationId(session.getConversationId())
                .state(session.getState())
                .selectedCategory(session.getSelectedCategory())
                .selectedFaqId(session.getSelectedFaqId())
                .interactionCount(session.getInteractionCount())
                .inquiryId(session.getInquiryId())
                .createdAt(session.getCreatedAt())
                .lastActivityAt(session.getLastActivityAt())
                .build();
    }
}
