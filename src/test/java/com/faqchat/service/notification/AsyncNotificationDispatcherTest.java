package com.faqchat.service.notification;

import com.faqchat.model.FeedbackRecord;
import com.faqchat.model.NotificationEvent;
import com.faqchat.model.Rating;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AsyncNotificationDispatcherTest {

    private static final NotificationEvent NEGATIVE = FeedbackRecord.builder()
            .conversationId("c1")
            .rating(Rating.NEGATIVE)
            .timestamp(Instant.EPOCH)
            .build();

    @Test
    void fansOutToEnabledChannelsThatAcceptTheEvent() {
        RecordingChannel accepting = new RecordingChannel(true, true);
        RecordingChannel disabled = new RecordingChannel(false, true);
        RecordingChannel filtering = new RecordingChannel(true, false);
        AsyncNotificationDispatcher dispatcher = new AsyncNotificationDispatcher(
                new SyncTaskExecutor(), List.of(accepting, disabled, filtering));

        dispatcher.notify(NEGATIVE);

        assertThat(accepting.received).containsExactly(NEGATIVE);
        assertThat(disabled.received).isEmpty();
        assertThat(filtering.received).isEmpty();
    }

    @Test
    void failingChannelDoesNotStopOthers() {
        RecordingChannel after = new RecordingChannel(true, true);
        NotificationChannel broken = new RecordingChannel(true, true) {
            @Override
            public void deliver(NotificationEvent event) {
                throw new IllegalStateException("webhook down");
            }
        };
        AsyncNotificationDispatcher dispatcher = new AsyncNotificationDispatcher(
                new SyncTaskExecutor(), List.of(broken, after));

        assertThatCode(() -> dispatcher.notify(NEGATIVE)).doesNotThrowAnyException();
        assertThat(after.received).containsExactly(NEGATIVE);
    }

    @Test
    void rejectedSubmissionIsSwallowed() {
        TaskExecutor full = task -> {
            throw new TaskRejectedException("queue full");
        };
        RecordingChannel channel = new RecordingChannel(true, true);
        AsyncNotificationDispatcher dispatcher = new AsyncNotificationDispatcher(full, List.of(channel));

        assertThatCode(() -> dispatcher.notify(NEGATIVE)).doesNotThrowAnyException();
        assertThat(channel.received).isEmpty();
    }

    @Test
    void nullEventIsIgnored() {
        RecordingChannel channel = new RecordingChannel(true, true);
        new AsyncNotificationDispatcher(new SyncTaskExecutor(), List.of(channel)).notify(null);

        assertThat(channel.received).isEmpty();
    }

    static class RecordingChannel implements NotificationChannel {

        final List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        private final boolean enabled;
        private final boolean accepts;

        RecordingChannel(boolean enabled, boolean accepts) {
            this.enabled = enabled;
            this.accepts = accepts;
        }

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public boolean accepts(NotificationEvent event) {
            return accepts;
        }

        @Override
        public void deliver(NotificationEvent event) {
            received.add(event);
        }
    }
}
