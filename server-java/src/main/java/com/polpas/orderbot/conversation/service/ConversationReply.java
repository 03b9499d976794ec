package com.polpas.orderbot.conversation.service;

/**
 * Outcome of one inbound message. {@code accepted=false} means the text did not fit what
 * the conversation expected; {@code message} is then guidance for the customer.
 */
public record ConversationReply(boolean accepted, String message) {

    public static ConversationReply accepted(String message) {
        return new ConversationReply(true, message);
    }

    public static ConversationReply silent() {
        return new ConversationReply(true, null);
    }

    public static ConversationReply rejected(String message) {
        return new ConversationReply(false, message);
    }
}
