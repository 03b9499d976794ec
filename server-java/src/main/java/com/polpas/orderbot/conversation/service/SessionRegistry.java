package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.ConversationException;
import com.polpas.orderbot.conversation.model.ConversationSession;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions by id, created on first use. Sessions live for the lifetime of the process.
 */
@Service
public class SessionRegistry {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final ProductCatalogService catalogService;
    private final Clock clock;

    public SessionRegistry(ProductCatalogService catalogService, Clock clock) {
        this.catalogService = catalogService;
        this.clock = clock;
    }

    /**
     * Returns the session for {@code sessionId}, creating it atomically if it does not exist.
     * The session id doubles as the owning user id.
     */
    public ConversationSession getOrCreate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ConversationException("Sessão inválida: informe um identificador.");
        }
        return sessions.computeIfAbsent(sessionId, id ->
                new ConversationSession(id, id, catalogService.newWorkingCatalog(), clock.instant()));
    }

    public Optional<ConversationSession> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int size() {
        return sessions.size();
    }
}
