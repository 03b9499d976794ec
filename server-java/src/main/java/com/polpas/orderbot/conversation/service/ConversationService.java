package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.ConversationSession;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Message-level entry point: resolves the session and hands the text to the state machine.
 */
@Service
public class ConversationService {

    private final SessionRegistry sessionRegistry;
    private final ConversationStateMachine stateMachine;

    public ConversationService(SessionRegistry sessionRegistry, ConversationStateMachine stateMachine) {
        this.sessionRegistry = sessionRegistry;
        this.stateMachine = stateMachine;
    }

    public ConversationReply processMessage(String sessionId, String text) {
        return stateMachine.processMessage(sessionRegistry.getOrCreate(sessionId), text);
    }

    /**
     * Oldest message queued by a timer, if any. Never blocks.
     */
    public Optional<String> fetchPendingMessage(String sessionId) {
        return sessionRegistry.getOrCreate(sessionId).pollMessage();
    }

    public Map<String, Integer> getCurrentOrders(String sessionId) {
        return sessionRegistry.getOrCreate(sessionId).getCurrentOrders();
    }

    public List<Map<String, Integer>> getConfirmedOrders(String sessionId) {
        return sessionRegistry.getOrCreate(sessionId).getConfirmedOrders();
    }

    public List<Map<String, Integer>> getPendingOrders(String sessionId) {
        return sessionRegistry.getOrCreate(sessionId).getPendingOrders();
    }

    public SessionSnapshot snapshot(String sessionId) {
        ConversationSession session = sessionRegistry.getOrCreate(sessionId);
        return new SessionSnapshot(
                session.getState(),
                session.getCurrentOrders(),
                session.getConfirmedOrders(),
                session.getPendingOrders(),
                session.getReminderCount(),
                session.getLastActivity());
    }

    public void resetSession(String sessionId) {
        stateMachine.restart(sessionRegistry.getOrCreate(sessionId), true);
    }
}
