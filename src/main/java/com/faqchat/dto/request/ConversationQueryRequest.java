package com.faqchat.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationQueryRequest {

    @NotBlank(message = "Conversation id is required")
    private String conversationId;

    @Size(max = 1000, message = "Question cannot exceed 1000 characters")
    private String question;
}
