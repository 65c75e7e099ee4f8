package com.faqchat.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormField {

    private String name;

    private String label;

    /**
     * text | email | textarea
     */
    private String type;

    private boolean required;
}
