package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.OrderStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class InMemoryOrderStore implements OrderStore {

    private final List<Row> rows = new ArrayList<>();
    private boolean failing;

    void failWrites(boolean failing) {
        this.failing = failing;
    }

    List<Row> rows() {
        return List.copyOf(rows);
    }

    List<Row> rows(OrderStatus status) {
        return rows.stream().filter(row -> row.status() == status).toList();
    }

    @Override
    public void persist(String sessionId, String userId, Map<String, Integer> lines, OrderStatus status, String groupId) {
        if (failing) {
            throw new IllegalStateException("database is locked");
        }
        lines.forEach((product, quantity) -> {
            if (quantity > 0) {
                rows.add(new Row(sessionId, userId, product, quantity, status, groupId));
            }
        });
    }

    @Override
    public Map<String, Integer> queryAggregated(String userId, OrderStatus status, String groupId) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (Row row : rows) {
            if (row.userId().equals(userId) && row.status() == status && row.groupId().equals(groupId)) {
                totals.merge(row.product(), row.quantity(), Integer::sum);
            }
        }
        return totals;
    }

    @Override
    public Map<String, Map<String, Integer>> findGroups(String userId, OrderStatus status) {
        Map<String, Map<String, Integer>> groups = new LinkedHashMap<>();
        for (Row row : rows) {
            if (row.userId().equals(userId) && row.status() == status && !OrderStatus.MAIN_GROUP.equals(row.groupId())) {
                groups.computeIfAbsent(row.groupId(), group -> new LinkedHashMap<>())
                        .merge(row.product(), row.quantity(), Integer::sum);
            }
        }
        return groups;
    }

    @Override
    public int promoteGroup(String userId, String groupId, OrderStatus fromStatus) {
        int moved = 0;
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            if (row.matches(userId, groupId, fromStatus)) {
                rows.set(i, new Row(row.sessionId(), row.userId(), row.product(), row.quantity(),
                        OrderStatus.CONFIRMED, OrderStatus.MAIN_GROUP));
                moved++;
            }
        }
        return moved;
    }

    @Override
    public int deleteGroup(String userId, String groupId, OrderStatus status) {
        int before = rows.size();
        rows.removeIf(row -> row.matches(userId, groupId, status));
        return before - rows.size();
    }

    record Row(String sessionId, String userId, String product, int quantity, OrderStatus status, String groupId) {

        boolean matches(String userId, String groupId, OrderStatus status) {
            return this.userId.equals(userId) && this.groupId.equals(groupId) && this.status == status;
        }
    }
}
