package com.polpas.orderbot.conversation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.polpas.orderbot.conversation.model.ConversationState;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {
    private boolean accepted;
    private String botMessage;
    private ConversationState state;
    private Map<String, Integer> currentOrders;
    private List<Map<String, Integer>> confirmedOrders;
    private List<Map<String, Integer>> pendingOrders;
}
