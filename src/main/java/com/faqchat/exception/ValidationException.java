package com.faqchat.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ValidationException extends ChatbotException {

    /**
     * Field name to problem description, in field order.
     */
    private final Map<String, String> fieldErrors;

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(ErrorCode.VALIDATION_FAILED, message);
        this.fieldErrors = fieldErrors;
    }
}
