package com.faqchat.service.feedback;

import com.faqchat.dto.request.FeedbackRequest;
import com.faqchat.model.ConversationSession;
import com.faqchat.model.FeedbackRecord;
import com.faqchat.model.Rating;
import com.faqchat.service.notification.NotificationSink;
import com.faqchat.service.session.SessionStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Turns feedback submissions into {@link FeedbackRecord}s for the notification sink.
 * Conversation context is attached when the session is still known; feedback for an expired
 * conversation is forwarded without it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final SessionStoreService sessionStore;
    private final NotificationSink notificationSink;
    private final Clock clock;

    public FeedbackRecord submit(FeedbackRequest request) {
        Optional<ConversationSession> session = sessionStore.find(request.getConversationId());

        FeedbackRecord feedback = FeedbackRecord.builder()
                .conversationId(request.getConversationId())
                .rating(request.getRating())
                .comment(request.getComment() != null && !request.getComment().isBlank()
                        ? request.getComment().trim()
                        : null)
                .timestamp(clock.instant())
                .state(session.map(ConversationSession::getState).orElse(null))
                .category(session.map(ConversationSession::getSelectedCategory).orElse(null))
                .interactionCount(session.map(ConversationSession::getInteractionCount).orElse(null))
                .build();

        if (feedback.rating() == Rating.NEGATIVE) {
            log.info("Negative feedback for conversation {}", feedback.conversationId());
        } else {
            log.debug("Positive feedback for conversation {}", feedback.conversationId());
        }

        notificationSink.notify(feedback);
        return feedback;
    }
}
