package com.faqchat.model;

import lombok.Builder;
import lombok.Value;

/**
 * One question/answer row of the knowledge base. Never mutated after load.
 */
@Value
@Builder
public class QaEntry {

    public static final int DEFAULT_DISPLAY_ORDER = 999;

    /** 1-based position in the dataset, stable for the lifetime of a snapshot. */
    int id;
    String question;
    String answer;
    String category;
    String reference;
    String remarks;
    @Builder.Default
    int displayOrder = DEFAULT_DISPLAY_ORDER;

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean hasReference() {
        return reference != null && !reference.isBlank();
    }

    public boolean inCategory(String label) {
        return hasCategory() && label != null && category.trim().equalsIgnoreCase(label.trim());
    }
}
