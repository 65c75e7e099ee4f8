package com.faqchat.exception;

import com.faqchat.model.ConversationEvent;
import com.faqchat.model.ConversationState;
import lombok.Getter;

@Getter
public class TransitionException extends ChatbotException {

    private final ConversationState state;
    private final ConversationEvent.Type event;

    public TransitionException(ConversationState state, ConversationEvent.Type event) {
        super(ErrorCode.TRANSITION_NOT_ALLOWED,
                "Event " + event + " is not allowed in state " + state);
        this.state = state;
        this.event = event;
    }
}
