package com.faqchat.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Search, citation, conversation, session and notification settings.
 * Dataset location lives in {@link DatasetConfig}.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "faq-chat")
public class ChatbotConfig {

    private Search search;
    private Citation citation;
    private Conversation conversation;
    private Session session;
    private Notification notification;

    /**
     * Optional display metadata keyed by category label (case-insensitive)
     */
    private Map<String, CategoryDisplay> categories = new LinkedHashMap<>();

    // ============================================================
    // Search Configuration
    // ============================================================
    @Data
    public static class Search {
        private Double threshold;
        private Integer topK;
        private Double tokenWeight;  // token overlap vs. edit-distance ratio
    }

    // ============================================================
    // Citation Configuration
    // ============================================================
    @Data
    public static class Citation {
        private Integer maxItems;
        private Integer excerptLength;
        private List<String> officialHosts;
    }

    // ============================================================
    // Conversation Configuration
    // ============================================================
    @Data
    public static class Conversation {
        private Integer maxFaqs;
        private Double inquirySuggestionBelow;
        private String estimatedResponseTime;
    }

    // ============================================================
    // Session Configuration
    // ============================================================
    @Data
    public static class Session {
        private Duration inactivityWindow;
    }

    // ============================================================
    // Notification Configuration
    // ============================================================
    @Data
    public static class Notification {
        private Integer corePoolSize;
        private Integer maxPoolSize;
        private Integer queueCapacity;
        private String slackWebhookUrl;
    }

    @Data
    public static class CategoryDisplay {
        private String name;
        private String description;
        private String emoji;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public double getThreshold() {
        return search != null && search.getThreshold() != null
                ? search.getThreshold()
                : 0.1;
    }

    public int getTopK() {
        return search != null && search.getTopK() != null
                ? search.getTopK()
                : 5;
    }

    public double getTokenWeight() {
        return search != null && search.getTokenWeight() != null
                ? search.getTokenWeight()
                : 0.7;
    }

    public int getMaxCitationItems() {
        return citation != null && citation.getMaxItems() != null
                ? citation.getMaxItems()
                : 3;
    }

    public int getExcerptLength() {
        return citation != null && citation.getExcerptLength() != null
                ? citation.getExcerptLength()
                : 200;
    }

    public List<String> getOfficialHosts() {
        return citation != null && citation.getOfficialHosts() != null
                ? citation.getOfficialHosts()
                : List.of();
    }

    public int getMaxFaqs() {
        return conversation != null && conversation.getMaxFaqs() != null
                ? conversation.getMaxFaqs()
                : 10;
    }

    public double getInquirySuggestionBelow() {
        return conversation != null && conversation.getInquirySuggestionBelow() != null
                ? conversation.getInquirySuggestionBelow()
                : 0.5;
    }

    public String getEstimatedResponseTime() {
        return conversation != null && conversation.getEstimatedResponseTime() != null
                ? conversation.getEstimatedResponseTime()
                : "1営業日以内";
    }

    public Duration getInactivityWindow() {
        return session != null && session.getInactivityWindow() != null
                ? session.getInactivityWindow()
                : Duration.ofHours(24);
    }

    public String getSlackWebhookUrl() {
        return notification != null ? notification.getSlackWebhookUrl() : null;
    }

    public CategoryDisplay findCategoryDisplay(String label) {
        if (label == null) {
            return null;
        }
        return categories.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(label.trim()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        validate();

        log.info("{}", "=".repeat(70));
        log.info("CHATBOT CONFIGURATION INITIALIZED");
        log.info("{}", "=".repeat(70));
        log.info("SEARCH: threshold={}, topK={}, tokenWeight={}",
                getThreshold(), getTopK(), getTokenWeight());
        log.info("CITATION: maxItems={}, excerptLength={}", getMaxCitationItems(), getExcerptLength());
        log.info("SESSION: inactivityWindow={}", getInactivityWindow());
        log.info("NOTIFICATION: slack={}", getSlackWebhookUrl() != null && !getSlackWebhookUrl().isBlank()
                ? "enabled" : "disabled");
        log.info("{}", "=".repeat(70));
    }

    /**
     * Fails startup on values the search and citation code cannot work with.
     */
    void validate() {
        requireFraction("faq-chat.search.threshold", getThreshold());
        requireFraction("faq-chat.search.token-weight", getTokenWeight());
        requireFraction("faq-chat.conversation.inquiry-suggestion-below", getInquirySuggestionBelow());
        requirePositive("faq-chat.search.top-k", getTopK());
        requirePositive("faq-chat.citation.max-items", getMaxCitationItems());
        requirePositive("faq-chat.citation.excerpt-length", getExcerptLength());
        requirePositive("faq-chat.conversation.max-faqs", getMaxFaqs());
    }

    private static void requireFraction(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException(key + " must be within [0, 1], was " + value);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalStateException(key + " must be at least 1, was " + value);
        }
    }
}
