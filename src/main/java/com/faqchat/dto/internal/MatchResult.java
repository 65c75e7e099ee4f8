package com.faqchat.dto.internal;

import com.faqchat.model.QaEntry;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class MatchResult {

    QaEntry entry;

    /** Blend of token overlap and edit-distance ratio, in [0, 1]. */
    double score;

    Set<String> matchedTerms;
}
