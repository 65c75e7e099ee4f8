package com.faqchat.model;

import lombok.Builder;

import java.time.Instant;

@Builder
public record InquirySubmission(
        String conversationId,
        String name,
        String company,
        String email,
        String message,
        Instant submittedAt,
        String inquiryId
) implements NotificationEvent {

    @Override
    public Instant timestamp() {
        return submittedAt;
    }

    @Override
    public String eventType() {
        return "inquiry";
    }
}
