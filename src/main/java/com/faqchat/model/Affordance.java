package com.faqchat.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Next actions a directive offers to the visitor.
 */
public enum Affordance {
    SELECT_CATEGORY("select_category"),
    MORE_QUESTIONS("more_questions"),
    START_INQUIRY("start_inquiry"),
    FEEDBACK("feedback"),
    RESTART("restart");

    private final String code;

    Affordance(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
