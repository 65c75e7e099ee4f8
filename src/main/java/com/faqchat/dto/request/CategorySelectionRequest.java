package com.faqchat.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorySelectionRequest {

    @NotBlank(message = "Conversation id is required")
    private String conversationId;

    @NotBlank(message = "Category id is required")
    private String categoryId;
}
