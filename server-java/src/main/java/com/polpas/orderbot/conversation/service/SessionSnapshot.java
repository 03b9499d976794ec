package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.ConversationState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SessionSnapshot(
        ConversationState state,
        Map<String, Integer> currentOrders,
        List<Map<String, Integer>> confirmedOrders,
        List<Map<String, Integer>> pendingOrders,
        int remindersSent,
        Instant lastActivity) {
}
