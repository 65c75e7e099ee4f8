package com.faqchat.service.conversation;

/**
 * Source of conversation and inquiry identifiers.
 */
public interface IdGenerator {

    String newConversationId();

    String newInquiryId(String conversationId);
}
