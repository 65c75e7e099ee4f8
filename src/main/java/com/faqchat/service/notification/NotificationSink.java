package com.faqchat.service.notification;

import com.faqchat.model.NotificationEvent;

/**
 * Outbound contract for interaction summaries, inquiries and feedback.
 *
 * <p>{@link #notify(NotificationEvent)} means "enqueued", not "delivered": it returns without
 * waiting and never throws. Delivery outcome has no effect on conversation state.</p>
 */
public interface NotificationSink {

    void notify(NotificationEvent event);
}
