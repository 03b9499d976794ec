package com.polpas.orderbot.conversation.model;

/**
 * A quantity found in the token stream: a digit literal or a parsed run of number words,
 * anchored at the position of its first token.
 */
public record NumberMatch(int position, int value) {
}
