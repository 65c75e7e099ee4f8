package com.faqchat.service.conversation;

import com.faqchat.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks the contact form before an inquiry is accepted.
 */
@Slf4j
@Component
public class InquiryValidator {

    public static final String NAME = "name";
    public static final String COMPANY = "company";
    public static final String EMAIL = "email";
    public static final String INQUIRY = "inquiry";

    public static final List<String> REQUIRED_FIELDS = List.of(NAME, COMPANY, EMAIL, INQUIRY);

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private static final Map<String, String> LABELS = Map.of(
            NAME, "お名前",
            COMPANY, "会社名",
            EMAIL, "メールアドレス",
            INQUIRY, "お問い合わせ内容"
    );

    /**
     * @return the form values, trimmed, keyed by field name
     * @throws ValidationException with one message per failing field
     */
    public Map<String, String> validate(Map<String, String> formData) {
        Map<String, String> values = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (String field : REQUIRED_FIELDS) {
            String value = formData != null ? formData.get(field) : null;
            if (value == null || value.isBlank()) {
                errors.put(field, labelFor(field) + "を入力してください");
                continue;
            }
            values.put(field, value.trim());
        }

        String email = values.get(EMAIL);
        if (email != null && !EMAIL_PATTERN.matcher(email).matches()) {
            errors.put(EMAIL, "有効なメールアドレスを入力してください");
        }

        if (!errors.isEmpty()) {
            log.debug("Inquiry form rejected: {}", errors.keySet());
            throw new ValidationException("Inquiry form is incomplete", errors);
        }
        return values;
    }

    public static String labelFor(String field) {
        return LABELS.getOrDefault(field, field);
    }
}
