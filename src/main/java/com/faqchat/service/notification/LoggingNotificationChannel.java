package com.faqchat.service.notification;

import com.faqchat.model.FeedbackRecord;
import com.faqchat.model.InquirySubmission;
import com.faqchat.model.InteractionEvent;
import com.faqchat.model.NotificationEvent;
import com.faqchat.model.Rating;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes every event to the application log.
 */
@Slf4j
@Component
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean accepts(NotificationEvent event) {
        return true;
    }

    @Override
    public void deliver(NotificationEvent event) {
        if (event instanceof InquirySubmission inquiry) {
            log.info("[notify] inquiry {}: {} ({}) <{}>",
                    inquiry.inquiryId(), inquiry.name(), inquiry.company(), inquiry.email());
        } else if (event instanceof FeedbackRecord feedback) {
            if (feedback.rating() == Rating.NEGATIVE) {
                log.warn("[notify] negative feedback for {}: {}", feedback.conversationId(), feedback.comment());
            } else {
                log.info("[notify] positive feedback for {}", feedback.conversationId());
            }
        } else if (event instanceof InteractionEvent interaction) {
            log.info("[notify] {} conversation={} category={} confidence={} question={}",
                    interaction.eventType(), interaction.conversationId(), interaction.category(),
                    interaction.confidence(), interaction.question());
        } else {
            log.info("[notify] {} for {}", event.eventType(), event.conversationId());
        }
    }
}
