package com.faqchat.model;

import java.util.Map;

/**
 * Inbound event for the conversation state machine. Only the payload fields relevant to
 * {@link #type()} are populated.
 */
public record ConversationEvent(
        Type type,
        String categoryId,
        String faqId,
        String query,
        Map<String, String> formData
) {

    public enum Type {
        WELCOME,
        SELECT_CATEGORY,
        SELECT_FAQ,
        FREE_TEXT_QUERY,
        START_INQUIRY,
        SUBMIT_INQUIRY,
        RESTART
    }

    public static ConversationEvent welcome() {
        return new ConversationEvent(Type.WELCOME, null, null, null, null);
    }

    public static ConversationEvent selectCategory(String categoryId) {
        return new ConversationEvent(Type.SELECT_CATEGORY, categoryId, null, null, null);
    }

    public static ConversationEvent selectFaq(String faqId) {
        return new ConversationEvent(Type.SELECT_FAQ, null, faqId, null, null);
    }

    public static ConversationEvent freeTextQuery(String query) {
        return new ConversationEvent(Type.FREE_TEXT_QUERY, null, null, query, null);
    }

    public static ConversationEvent startInquiry() {
        return new ConversationEvent(Type.START_INQUIRY, null, null, null, null);
    }

    public static ConversationEvent submitInquiry(Map<String, String> formData) {
        return new ConversationEvent(Type.SUBMIT_INQUIRY, null, null, null,
                formData != null ? formData : Map.of());
    }

    public static ConversationEvent restart() {
        return new ConversationEvent(Type.RESTART, null, null, null, null);
    }
}
