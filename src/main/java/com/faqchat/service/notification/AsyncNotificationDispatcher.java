package com.faqchat.service.notification;

import com.faqchat.model.NotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hands events to the notification executor and fans them out to every enabled channel.
 * Failures are logged here and go no further.
 */
@Slf4j
@Service
public class AsyncNotificationDispatcher implements NotificationSink {

    private final TaskExecutor executor;
    private final List<NotificationChannel> channels;

    public AsyncNotificationDispatcher(@Qualifier("notificationTaskExecutor") TaskExecutor executor,
                                       List<NotificationChannel> channels) {
        this.executor = executor;
        this.channels = List.copyOf(channels);
    }

    @Override
    public void notify(NotificationEvent event) {
        if (event == null) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RuntimeException e) {
            log.warn("Notification {} for {} dropped: {}",
                    event.eventType(), event.conversationId(), e.getMessage());
        }
    }

    void deliver(NotificationEvent event) {
        for (NotificationChannel channel : channels) {
            if (!channel.isEnabled() || !channel.accepts(event)) {
                continue;
            }
            try {
                channel.deliver(event);
            } catch (RuntimeException e) {
                log.error("Channel {} failed to deliver {} for {}: {}",
                        channel.name(), event.eventType(), event.conversationId(), e.getMessage(), e);
            }
        }
    }
}
