package com.faqchat.model;

public enum ConversationState {
    INITIAL,
    CATEGORY_SELECTION,
    FAQ_SELECTION,
    INQUIRY_FORM,
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
