package com.faqchat.service.session;

import com.faqchat.model.ConversationSession;

/**
 * Access to one conversation's record while its lock is held.
 */
public interface SessionHandle {

    ConversationSession session();

    /** True when the record was created by the current call. */
    boolean isNew();

    /** Replace the record with a fresh one for the same id, discarding prior selections. */
    ConversationSession renew();
}
