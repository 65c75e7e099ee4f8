package com.faqchat.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CategoryOption {

    /**
     * Category label as it appears in the dataset; sent back as {@code categoryId}
     */
    private String id;

    private String name;

    private String description;

    private String emoji;
}
