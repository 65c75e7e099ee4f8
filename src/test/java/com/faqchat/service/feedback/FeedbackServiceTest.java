package com.faqchat.service.feedback;

import com.faqchat.dto.request.FeedbackRequest;
import com.faqchat.model.ConversationState;
import com.faqchat.model.FeedbackRecord;
import com.faqchat.model.Rating;
import com.faqchat.service.notification.NotificationSink;
import com.faqchat.service.session.SessionStoreService;
import com.faqchat.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class FeedbackServiceTest {

    private final SessionStoreService sessionStore =
            new SessionStoreService(TestFixtures.fixedClock(), TestFixtures.chatbotConfig());
    private final NotificationSink sink = mock(NotificationSink.class);
    private final FeedbackService service = new FeedbackService(sessionStore, sink, TestFixtures.fixedClock());

    @Test
    void attachesConversationContextWhenKnown() {
        sessionStore.execute("c1", true, h -> {
            h.session().setState(ConversationState.FAQ_SELECTION);
            h.session().setSelectedCategory("general");
            h.session().setInteractionCount(4);
            return null;
        });

        FeedbackRecord feedback = service.submit(FeedbackRequest.builder()
                .conversationId("c1")
                .rating(Rating.NEGATIVE)
                .comment("  答えが見つからない  ")
                .build());

        assertThat(feedback.rating()).isEqualTo(Rating.NEGATIVE);
        assertThat(feedback.comment()).isEqualTo("答えが見つからない");
        assertThat(feedback.state()).isEqualTo(ConversationState.FAQ_SELECTION);
        assertThat(feedback.category()).isEqualTo("general");
        assertThat(feedback.interactionCount()).isEqualTo(4);
        assertThat(feedback.timestamp()).isEqualTo(TestFixtures.NOW);
        assertThat(feedback.eventType()).isEqualTo("feedback_negative");
        verify(sink).notify(feedback);
    }

    @Test
    void forwardsFeedbackForUnknownConversationWithoutContext() {
        FeedbackRecord feedback = service.submit(FeedbackRequest.builder()
                .conversationId("expired")
                .rating(Rating.POSITIVE)
                .comment(" ")
                .build());

        assertThat(feedback.state()).isNull();
        assertThat(feedback.interactionCount()).isNull();
        assertThat(feedback.comment()).isNull();
        verify(sink).notify(feedback);
    }

    @Test
    void everySubmissionIsForwardedIndependently() {
        FeedbackRequest request = FeedbackRequest.builder().conversationId("c1").rating(Rating.POSITIVE).build();

        service.submit(request);
        service.submit(request);

        ArgumentCaptor<FeedbackRecord> captor = ArgumentCaptor.forClass(FeedbackRecord.class);
        verify(sink, times(2)).notify(captor.capture());
        List<FeedbackRecord> sent = captor.getAllValues();
        assertThat(sent).hasSize(2).allSatisfy(f -> assertThat(f.conversationId()).isEqualTo("c1"));
    }
}
