package com.faqchat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Rating {
    POSITIVE,
    NEGATIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Rating fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("rating is required");
        }
        for (Rating rating : values()) {
            if (rating.code().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return rating;
            }
        }
        throw new IllegalArgumentException("rating must be 'positive' or 'negative'");
    }
}
