package com.polpas.orderbot.conversation.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class OrdersResponse {
    private Map<String, Integer> currentOrders;
    private List<Map<String, Integer>> confirmedOrders;
    private List<Map<String, Integer>> pendingOrders;
}
