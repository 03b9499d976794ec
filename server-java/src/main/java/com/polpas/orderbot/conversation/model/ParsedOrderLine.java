package com.polpas.orderbot.conversation.model;

/**
 * One product/quantity association resolved from a single message.
 *
 * @param score similarity of the matched phrase to the product name, 0 to 100
 */
public record ParsedOrderLine(String product, int quantity, double score) {
}
