package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.OrderStatus;

import java.util.Map;

/**
 * Where confirmed, auto-confirmed and held orders end up. The conversation only writes
 * here when an order leaves the working catalog; it never reads back mid-conversation.
 */
public interface OrderStore {

    /**
     * Stores one row per product with a positive quantity.
     */
    void persist(String sessionId, String userId, Map<String, Integer> lines, OrderStatus status, String groupId);

    /**
     * Product totals for one group, highest total first.
     */
    Map<String, Integer> queryAggregated(String userId, OrderStatus status, String groupId);

    /**
     * Every group with the given status, each as product to quantity.
     */
    Map<String, Map<String, Integer>> findGroups(String userId, OrderStatus status);

    /**
     * Moves a group into the main confirmed list.
     *
     * @return number of rows moved, zero when the group does not exist with {@code fromStatus}
     */
    int promoteGroup(String userId, String groupId, OrderStatus fromStatus);

    /**
     * @return number of rows removed
     */
    int deleteGroup(String userId, String groupId, OrderStatus status);
}
