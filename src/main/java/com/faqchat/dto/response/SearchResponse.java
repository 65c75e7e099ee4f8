package com.faqchat.dto.response;

import com.faqchat.dto.internal.CitationSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    // ================= CORE RESPONSE =================
    private String question;

    private String answer;

    private double confidence;

    /**
     * Category of the best match, null when nothing matched
     */
    private String category;

    /**
     * Reference note of the best match
     */
    private String source;

    private boolean found;

    /**
     * True when nothing matched or the best match is low-confidence
     */
    private boolean suggestInquiry;

    private CitationSet citations;
}
