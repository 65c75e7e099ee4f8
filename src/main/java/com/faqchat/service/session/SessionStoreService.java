package com.faqchat.service.session;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.exception.NotFoundException;
import com.faqchat.model.ConversationSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Registry of conversation sessions keyed by conversation id.
 *
 * <p>Every read-modify-write runs through {@link #execute}, which holds a lock scoped to the
 * conversation id, so at most one transition per conversation is in flight. Different
 * conversations never contend.</p>
 */
@Slf4j
@Service
public class SessionStoreService {

    private final Clock clock;
    private final ChatbotConfig chatbotConfig;

    private final Map<String, Slot> sessions = new ConcurrentHashMap<>();

    public SessionStoreService(Clock clock, ChatbotConfig chatbotConfig) {
        this.clock = clock;
        this.chatbotConfig = chatbotConfig;
    }

    /**
     * Run {@code action} against the session for {@code conversationId} under its lock.
     *
     * @throws NotFoundException when the session does not exist and {@code createIfMissing} is false
     */
    public <T> T execute(String conversationId, boolean createIfMissing, Function<SessionHandle, T> action) {
        while (true) {
            Slot slot = createIfMissing
                    ? sessions.computeIfAbsent(conversationId, id -> new Slot())
                    : sessions.get(conversationId);
            if (slot == null) {
                throw NotFoundException.conversation(conversationId);
            }

            slot.lock.lock();
            try {
                if (slot.evicted) {
                    // lost a race with the sweep, look the id up again
                    continue;
                }
                boolean created = false;
                if (slot.session == null) {
                    slot.session = ConversationSession.fresh(conversationId, clock.instant());
                    created = true;
                    log.info("Creating new session: {}", conversationId);
                }
                return action.apply(new LockedHandle(slot, created));
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Read-only copy of a session
     */
    public Optional<ConversationSession> find(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        Slot slot = sessions.get(conversationId);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            return slot.evicted || slot.session == null
                    ? Optional.empty()
                    : Optional.of(slot.session.copy());
        } finally {
            slot.lock.unlock();
        }
    }

    public boolean sessionExists(String conversationId) {
        return find(conversationId).isPresent();
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${faq-chat.session.sweep-interval-ms:300000}",
            initialDelayString = "${faq-chat.session.sweep-interval-ms:300000}")
    public void sweepExpiredSessions() {
        int evicted = evictIdle(clock.instant());
        if (evicted > 0) {
            log.info("Evicted {} inactive session(s), {} remaining", evicted, sessions.size());
        }
    }

    /**
     * Remove sessions idle longer than the inactivity window. Sessions whose lock is held
     * (a transition is in flight) are skipped until the next sweep.
     */
    public int evictIdle(Instant now) {
        Instant cutoff = now.minus(chatbotConfig.getInactivityWindow());
        int evicted = 0;

        for (Map.Entry<String, Slot> entry : sessions.entrySet()) {
            Slot slot = entry.getValue();
            if (!slot.lock.tryLock()) {
                continue;
            }
            try {
                if (slot.session != null && slot.session.getLastActivityAt().isBefore(cutoff)) {
                    slot.evicted = true;
                    sessions.remove(entry.getKey(), slot);
                    evicted++;
                    log.debug("Evicted inactive session: {}", entry.getKey());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return evicted;
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private ConversationSession session;
        private boolean evicted;
    }

    private final class LockedHandle implements SessionHandle {

        private final Slot slot;
        private final boolean created;

        private LockedHandle(Slot slot, boolean created) {
            this.slot = slot;
            this.created = created;
        }

        @Override
        public ConversationSession session() {
            return slot.session;
        }

        @Override
        public boolean isNew() {
            return created;
        }

        @Override
        public ConversationSession renew() {
            String conversationId = slot.session.getConversationId();
            slot.session = ConversationSession.fresh(conversationId, clock.instant());
            log.info("Session restarted: {}", conversationId);
            return slot.session;
        }
    }
}
