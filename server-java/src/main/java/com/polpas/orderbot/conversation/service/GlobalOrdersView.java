package com.polpas.orderbot.conversation.service;

import java.util.Map;

/**
 * Everything stored for a user: the main confirmed totals plus the auto-confirmed and
 * pending groups still waiting for a decision.
 */
public record GlobalOrdersView(
        Map<String, Integer> mainOrders,
        Map<String, Map<String, Integer>> autoOrders,
        Map<String, Map<String, Integer>> pendingOrders) {
}
