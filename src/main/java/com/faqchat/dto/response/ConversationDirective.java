package com.faqchat.dto.response;

import com.faqchat.dto.internal.CitationSet;
import com.faqchat.exception.ErrorCode;
import com.faqchat.model.Affordance;
import com.faqchat.model.ConversationState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * What the client should render next. Only the fields relevant to {@link #type} are populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationDirective {

    public enum Type {
        WELCOME,
        CATEGORY_SELECTION,
        FAQ_SELECTION,
        FAQ_ANSWER,
        SEARCH_RESULT,
        INQUIRY_FORM,
        INQUIRY_RECEIPT,
        ERROR
    }

    // ================= CORE =================
    private Type type;

    private String conversationId;

    /**
     * Session state after the event was handled
     */
    private ConversationState state;

    private String message;

    private List<Affordance> affordances;

    // ================= SELECTION =================
    private List<CategoryOption> categories;

    private String selectedCategory;

    private List<FaqOption> faqs;

    // ================= ANSWER / SEARCH =================
    private String question;

    private String answer;

    private Double confidence;

    private CitationSet citations;

    // ================= INQUIRY =================
    private List<FormField> formFields;

    private String inquiryId;

    private String estimatedResponseTime;

    // ================= ERROR =================
    private ErrorCode errorCode;

    private Map<String, String> fieldErrors;

    @JsonIgnore
    public boolean isError() {
        return type == Type.ERROR;
    }
}
