package com.faqchat.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InquiryRequest {

    @NotBlank(message = "Conversation id is required")
    private String conversationId;

    /**
     * name, company, email, inquiry. Field checks happen in the conversation flow so that
     * errors come back per field.
     */
    @Builder.Default
    private Map<String, String> formData = new LinkedHashMap<>();
}
