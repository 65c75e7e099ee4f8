package com.faqchat.exception;

public class NotFoundException extends ChatbotException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException conversation(String conversationId) {
        return new NotFoundException("Unknown conversation: " + conversationId);
    }

    public static NotFoundException category(String categoryId) {
        return new NotFoundException("Unknown category: " + categoryId);
    }

    public static NotFoundException faq(String faqId) {
        return new NotFoundException("Unknown FAQ: " + faqId);
    }
}
