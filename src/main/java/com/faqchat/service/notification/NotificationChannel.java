package com.faqchat.service.notification;

import com.faqchat.model.NotificationEvent;

/**
 * One delivery target behind the {@link NotificationSink}.
 */
public interface NotificationChannel {

    String name();

    boolean isEnabled();

    boolean accepts(NotificationEvent event);

    void deliver(NotificationEvent event);
}
