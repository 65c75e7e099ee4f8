package com.faqchat.exception;

import lombok.Getter;

@Getter
public class ChatbotException extends RuntimeException {

    private final ErrorCode errorCode;

    public ChatbotException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChatbotException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
