package com.polpas.orderbot.controller;

import com.polpas.orderbot.conversation.dto.MessageRequest;
import com.polpas.orderbot.conversation.dto.MessageResponse;
import com.polpas.orderbot.conversation.dto.OrderGroupRequest;
import com.polpas.orderbot.conversation.dto.OrdersResponse;
import com.polpas.orderbot.conversation.dto.SessionRequest;
import com.polpas.orderbot.conversation.dto.UpdatesResponse;
import com.polpas.orderbot.conversation.service.ConversationReply;
import com.polpas.orderbot.conversation.service.ConversationService;
import com.polpas.orderbot.conversation.service.GlobalOrdersView;
import com.polpas.orderbot.conversation.service.OrderGroupService;
import com.polpas.orderbot.conversation.service.SessionSnapshot;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Chat surface used by the web client. The session id is the customer's user id.
 */
@RestController
@RequestMapping("/api/orders")
public class OrderBotController {

    private final ConversationService conversationService;
    private final OrderGroupService orderGroupService;

    public OrderBotController(ConversationService conversationService, OrderGroupService orderGroupService) {
        this.conversationService = conversationService;
        this.orderGroupService = orderGroupService;
    }

    @PostMapping("/messages")
    public ResponseEntity<MessageResponse> sendMessage(@Valid @RequestBody MessageRequest request) {
        ConversationReply reply = conversationService.processMessage(request.getSessionId(), request.getMessage().trim());
        SessionSnapshot snapshot = conversationService.snapshot(request.getSessionId());
        return ResponseEntity.ok(new MessageResponse(
                reply.accepted(),
                reply.message(),
                snapshot.state(),
                snapshot.currentOrders(),
                snapshot.confirmedOrders(),
                snapshot.pendingOrders()));
    }

    @PostMapping("/updates")
    public ResponseEntity<UpdatesResponse> updates(@Valid @RequestBody SessionRequest request) {
        String pending = conversationService.fetchPendingMessage(request.getSessionId()).orElse(null);
        SessionSnapshot snapshot = conversationService.snapshot(request.getSessionId());
        return ResponseEntity.ok(new UpdatesResponse(
                snapshot.state(),
                snapshot.currentOrders(),
                snapshot.confirmedOrders(),
                snapshot.pendingOrders(),
                snapshot.remindersSent(),
                snapshot.lastActivity(),
                pending != null,
                pending));
    }

    @GetMapping("/current")
    public ResponseEntity<OrdersResponse> currentOrders(@RequestParam String sessionId) {
        return ResponseEntity.ok(new OrdersResponse(
                conversationService.getCurrentOrders(sessionId),
                conversationService.getConfirmedOrders(sessionId),
                conversationService.getPendingOrders(sessionId)));
    }

    @GetMapping("/global")
    public ResponseEntity<GlobalOrdersView> globalOrders(@RequestParam String sessionId) {
        return ResponseEntity.ok(orderGroupService.getGlobalOrders(sessionId));
    }

    @PostMapping("/auto-groups/confirm")
    public ResponseEntity<Map<String, Boolean>> confirmAutoGroup(@Valid @RequestBody OrderGroupRequest request) {
        orderGroupService.confirmAutoGroup(request.getSessionId(), request.getOrderGroup());
        return ResponseEntity.ok(Map.of("success", true));
    }

    @PostMapping("/auto-groups/delete")
    public ResponseEntity<Map<String, Boolean>> deleteAutoGroup(@Valid @RequestBody OrderGroupRequest request) {
        orderGroupService.deleteAutoGroup(request.getSessionId(), request.getOrderGroup());
        return ResponseEntity.ok(Map.of("success", true));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Boolean>> reset(@Valid @RequestBody SessionRequest request) {
        conversationService.resetSession(request.getSessionId());
        return ResponseEntity.ok(Map.of("success", true));
    }
}
