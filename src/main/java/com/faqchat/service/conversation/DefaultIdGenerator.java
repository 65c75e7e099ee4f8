package com.faqchat.service.conversation;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Random UUIDs for conversations; {@code INQ-yyyyMMdd-NNNNNN} for inquiries, numbered by a
 * monotonic counter owned by this bean.
 */
@Component
public class DefaultIdGenerator implements IdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong inquirySequence = new AtomicLong();

    public DefaultIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String newConversationId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public String newInquiryId(String conversationId) {
        return String.format("INQ-%s-%06d", DAY.format(clock.instant()), inquirySequence.incrementAndGet());
    }
}
