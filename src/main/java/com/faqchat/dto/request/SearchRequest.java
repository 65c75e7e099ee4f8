package com.faqchat.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @Size(max = 1000, message = "Question cannot exceed 1000 characters")
    private String question;

    /**
     * Optional category label to narrow the search
     */
    private String category;

    private String conversationId;
}
