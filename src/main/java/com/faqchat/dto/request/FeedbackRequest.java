package com.faqchat.dto.request;

import com.faqchat.model.Rating;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotBlank(message = "Conversation id is required")
    private String conversationId;

    @NotNull(message = "Rating must be 'positive' or 'negative'")
    private Rating rating;

    @Size(max = 2000, message = "Comment cannot exceed 2000 characters")
    private String comment;
}
