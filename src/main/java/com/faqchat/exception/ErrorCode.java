package com.faqchat.exception;

public enum ErrorCode {
    GENERAL_ERROR,
    DATASET_ERROR,
    VALIDATION_FAILED,
    TRANSITION_NOT_ALLOWED,
    NOT_FOUND
}
