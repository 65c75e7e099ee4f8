package com.faqchat.service.notification;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.model.FeedbackRecord;
import com.faqchat.model.InquirySubmission;
import com.faqchat.model.InteractionEvent;
import com.faqchat.model.NotificationEvent;
import com.faqchat.model.Rating;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Posts inquiries, negative feedback and dataset reloads to a Slack incoming webhook.
 * Disabled unless {@code faq-chat.notification.slack-webhook-url} is set.
 */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private final ChatbotConfig chatbotConfig;
    private final RestTemplate restTemplate;

    public SlackNotificationChannel(ChatbotConfig chatbotConfig, RestTemplateBuilder restTemplateBuilder) {
        this.chatbotConfig = chatbotConfig;
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        String url = chatbotConfig.getSlackWebhookUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public boolean accepts(NotificationEvent event) {
        if (event instanceof InquirySubmission) {
            return true;
        }
        if (event instanceof FeedbackRecord feedback) {
            return feedback.rating() == Rating.NEGATIVE;
        }
        return event instanceof InteractionEvent interaction
                && interaction.kind() == InteractionEvent.Kind.DATASET_RELOAD;
    }

    @Override
    @CircuitBreaker(name = "slack", fallbackMethod = "deliverFallback")
    public void deliver(NotificationEvent event) {
        restTemplate.postForEntity(chatbotConfig.getSlackWebhookUrl(), Map.of("text", format(event)), String.class);
        log.debug("Slack notification sent: {}", event.eventType());
    }

    @SuppressWarnings("unused")
    private void deliverFallback(NotificationEvent event, Throwable t) {
        log.warn("Slack notification {} for {} not delivered: {}",
                event.eventType(), event.conversationId(), t.getMessage());
    }

    String format(NotificationEvent event) {
        if (event instanceof InquirySubmission inquiry) {
            return String.format("新しいお問い合わせ %s%n%s (%s) - %s%n%s",
                    inquiry.inquiryId(), inquiry.name(), inquiry.company(), inquiry.email(), inquiry.message());
        }
        if (event instanceof FeedbackRecord feedback) {
            return String.format("ネガティブフィードバック: conversation=%s state=%s category=%s%n%s",
                    feedback.conversationId(), feedback.state(), feedback.category(),
                    feedback.comment() != null ? feedback.comment() : "");
        }
        if (event instanceof InteractionEvent interaction) {
            return "データソース変更: " + interaction.answerPreview();
        }
        return event.eventType();
    }
}
