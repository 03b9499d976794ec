package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.conversation.model.ConversationSession;
import com.polpas.orderbot.conversation.model.ConversationState;
import com.polpas.orderbot.conversation.model.HeldOrder;
import com.polpas.orderbot.conversation.model.OrderStatus;
import com.polpas.orderbot.conversation.util.TextNormalizer;
import com.polpas.orderbot.scheduler.ConversationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives a conversation through menu, collection, confirmation and the reminder cycle.
 * Inbound messages and timer callbacks for one session are serialized on the session lock;
 * callbacks re-check that they are still the armed timer before touching anything.
 */
@Component
public class ConversationStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(ConversationStateMachine.class);

    static final String MENU_PROMPT = "🔄 **Conversa reiniciada!**\n\nVocê quer pedir(1) ou falar com o gerente(2)?";
    static final String MENU_RETRY = "Por favor, escolha uma opção: 1 para pedir ou 2 para falar com o gerente.";
    static final String ORDER_PROMPT = "Ótimo! Digite seus pedidos. Ex: '2 mangas e 3 queijos'";
    static final String MANAGER_ACK = "Ok então.";
    static final String RESTARTED = "🔄 **Conversa reiniciada!**";
    static final String PREPARING_SUMMARY = "📋 Preparando seu resumo...";
    static final String EMPTY_LIST = "❌ Lista vazia. Adicione itens primeiro.";
    static final String NOTHING_RECOGNIZED = "❌ Nenhum item reconhecido. Tente usar termos como '2 mangas', 'cinco queijos', etc.";
    static final String LIST_CLEARED = "🔄 **Lista limpa!** Digite novos itens.";
    static final String CONFIRMING_HINT = "❌ Item não reconhecido. Digite 'confirmar' para confirmar ou 'nao' para cancelar.";
    static final String AUTO_CONFIRMED = "🟡 **PEDIDO CONFIRMADO AUTOMATICAMENTE** - O pedido foi salvo e aguarda sua confirmação final na barra lateral.";
    static final String PENDING_HINT = "❌ Por favor, confirme ou cancele o pedido pendente. Digite 'confirmar' para confirmar ou 'nao' para cancelar.";
    static final String PENDING_CANCELLED = "🔄 Pedidos pendentes cancelados. Continue adicionando itens.";
    static final String PENDING_CONFIRMED = "✅ **PEDIDO PENDENTE CONFIRMADO!** %d pedido(s) adicionado(s) à lista.";

    private static final List<String> CANCEL_PHRASES = List.of("cancelar", "hoje nao");
    private static final Set<String> AFFIRMATIVE = Set.of("confirmar", "sim", "s");
    private static final Set<String> NEGATIVE = Set.of("nao", "n");
    private static final Set<String> READY_COMMANDS = Set.of("pronto", "confirmar");

    private final OrderExtractor orderExtractor;
    private final OrderStore orderStore;
    private final ConversationScheduler scheduler;
    private final OrderSummaryFormatter formatter;
    private final OrderGroupIdGenerator groupIdGenerator;
    private final TextNormalizer normalizer;
    private final Clock clock;
    private final Duration inactivityDelay;
    private final Duration reminderDelay;
    private final int maxReminders;
    private final ReminderExhaustion exhaustion;

    public ConversationStateMachine(OrderExtractor orderExtractor,
                                    OrderStore orderStore,
                                    ConversationScheduler scheduler,
                                    OrderSummaryFormatter formatter,
                                    OrderGroupIdGenerator groupIdGenerator,
                                    TextNormalizer normalizer,
                                    Clock clock,
                                    @Value("${orderbot.conversation.inactivity-seconds:5}") long inactivitySeconds,
                                    @Value("${orderbot.conversation.reminder-seconds:5}") long reminderSeconds,
                                    @Value("${orderbot.conversation.max-reminders:5}") int maxReminders,
                                    @Value("${orderbot.conversation.reminder-exhaustion:AUTO_CONFIRM}") ReminderExhaustion exhaustion) {
        this.orderExtractor = orderExtractor;
        this.orderStore = orderStore;
        this.scheduler = scheduler;
        this.formatter = formatter;
        this.groupIdGenerator = groupIdGenerator;
        this.normalizer = normalizer;
        this.clock = clock;
        this.inactivityDelay = Duration.ofSeconds(inactivitySeconds);
        this.reminderDelay = Duration.ofSeconds(reminderSeconds);
        this.maxReminders = maxReminders;
        this.exhaustion = exhaustion;
    }

    public ConversationReply processMessage(ConversationSession session, String text) {
        String folded = normalizer.fold(text);
        session.getLock().lock();
        try {
            session.touch(clock.instant());
            if (isCancel(folded)) {
                restart(session, false);
                return ConversationReply.silent();
            }
            return switch (session.getState()) {
                case WAITING_FOR_NEXT -> {
                    session.setState(ConversationState.OPTION);
                    yield ConversationReply.accepted(MENU_PROMPT);
                }
                case OPTION -> handleOption(session, folded);
                case COLLECTING -> handleCollecting(session, text, folded);
                case CONFIRMING -> handleConfirming(session, text, folded);
                case PENDING_CONFIRMATION -> handlePending(session, text, folded);
            };
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * Drops the working order and timers and goes back to waiting for the next message.
     * Confirmed history and held orders are kept.
     */
    public void restart(ConversationSession session, boolean announce) {
        session.getLock().lock();
        try {
            session.cancelTimer();
            session.resetWorkingCatalog();
            session.setReminderCount(0);
            session.setState(ConversationState.WAITING_FOR_NEXT);
            if (announce) {
                session.enqueueMessage(RESTARTED);
            }
            logger.debug("Session {} restarted", session.getSessionId());
        } finally {
            session.getLock().unlock();
        }
    }

    private ConversationReply handleOption(ConversationSession session, String folded) {
        if ("1".equals(folded)) {
            session.setState(ConversationState.COLLECTING);
            armInactivityTimer(session);
            return ConversationReply.accepted(ORDER_PROMPT);
        }
        if ("2".equals(folded)) {
            session.setState(ConversationState.WAITING_FOR_NEXT);
            return ConversationReply.accepted(MANAGER_ACK);
        }
        return ConversationReply.rejected(MENU_RETRY);
    }

    private ConversationReply handleCollecting(ConversationSession session, String text, String folded) {
        if (READY_COMMANDS.contains(folded)) {
            if (!session.hasItems()) {
                return ConversationReply.rejected(EMPTY_LIST);
            }
            sendSummary(session);
            return ConversationReply.accepted(PREPARING_SUMMARY);
        }
        ExtractionResult result = orderExtractor.extract(text, session.getWorkingCatalog());
        session.setWorkingCatalog(result.catalog());
        armInactivityTimer(session);
        return result.isEmpty() ? ConversationReply.rejected(NOTHING_RECOGNIZED) : ConversationReply.silent();
    }

    private ConversationReply handleConfirming(ConversationSession session, String text, String folded) {
        Set<String> words = words(folded);
        if (containsAny(words, AFFIRMATIVE)) {
            if (!session.hasItems()) {
                return ConversationReply.rejected(EMPTY_LIST);
            }
            session.cancelTimer();
            Map<String, Integer> order = session.getCurrentOrders();
            orderStore.persist(session.getSessionId(), session.getUserId(), order, OrderStatus.CONFIRMED, OrderStatus.MAIN_GROUP);
            session.addConfirmedOrder(order);
            clearWorkingOrder(session);
            logger.info("Session {} confirmed order {}", session.getSessionId(), order);
            return ConversationReply.accepted(formatter.confirmed(order));
        }
        if (containsAny(words, NEGATIVE)) {
            clearWorkingOrder(session);
            armInactivityTimer(session);
            return ConversationReply.accepted(LIST_CLEARED);
        }
        ExtractionResult result = orderExtractor.extract(text, session.getWorkingCatalog());
        if (result.isEmpty()) {
            return ConversationReply.rejected(CONFIRMING_HINT);
        }
        session.setWorkingCatalog(result.catalog());
        session.setState(ConversationState.COLLECTING);
        session.setReminderCount(0);
        armInactivityTimer(session);
        return ConversationReply.silent();
    }

    private ConversationReply handlePending(ConversationSession session, String text, String folded) {
        Set<String> words = words(folded);
        boolean affirmative = containsAny(words, AFFIRMATIVE);
        boolean negative = containsAny(words, NEGATIVE);
        if (affirmative && !session.getHeldOrders().isEmpty()) {
            List<HeldOrder> held = session.getHeldOrders();
            for (HeldOrder order : held) {
                orderStore.promoteGroup(session.getUserId(), order.groupId(), OrderStatus.PENDING);
                session.addConfirmedOrder(order.items());
            }
            int count = held.size();
            session.clearHeldOrders();
            session.setState(ConversationState.COLLECTING);
            armInactivityTimer(session);
            logger.info("Session {} confirmed {} held order(s)", session.getSessionId(), count);
            return ConversationReply.accepted(PENDING_CONFIRMED.formatted(count));
        }
        if (negative) {
            for (HeldOrder order : session.getHeldOrders()) {
                orderStore.deleteGroup(session.getUserId(), order.groupId(), OrderStatus.PENDING);
            }
            session.clearHeldOrders();
            session.setState(ConversationState.COLLECTING);
            armInactivityTimer(session);
            logger.info("Session {} discarded its held orders", session.getSessionId());
            return ConversationReply.accepted(PENDING_CANCELLED);
        }
        if (affirmative) {
            return ConversationReply.rejected(PENDING_HINT);
        }
        session.setState(ConversationState.COLLECTING);
        ExtractionResult result = orderExtractor.extract(text, session.getWorkingCatalog());
        session.setWorkingCatalog(result.catalog());
        armInactivityTimer(session);
        return ConversationReply.silent();
    }

    void onInactivityTimeout(ConversationSession session, long generation) {
        session.getLock().lock();
        try {
            if (!session.isCurrentTimer(generation)) {
                logger.debug("Ignoring stale inactivity timer for session {}", session.getSessionId());
                return;
            }
            session.timerFired();
            if (session.getState() != ConversationState.COLLECTING) {
                logger.warn("Inactivity timer fired for session {} in state {}", session.getSessionId(), session.getState());
                return;
            }
            if (session.hasItems()) {
                sendSummary(session);
            } else {
                armInactivityTimer(session);
            }
        } finally {
            session.getLock().unlock();
        }
    }

    void onReminderTimeout(ConversationSession session, long generation) {
        session.getLock().lock();
        try {
            if (!session.isCurrentTimer(generation)) {
                logger.debug("Ignoring stale reminder timer for session {}", session.getSessionId());
                return;
            }
            session.timerFired();
            int reminder = session.getReminderCount();
            if (session.getState() != ConversationState.CONFIRMING || reminder > maxReminders) {
                logger.warn("Reminder timer fired for session {} in state {} (reminder {})",
                        session.getSessionId(), session.getState(), reminder);
                return;
            }
            session.enqueueMessage(formatter.reminder(reminder, maxReminders, session.getCurrentOrders()));
            if (reminder == maxReminders) {
                onRemindersExhausted(session);
            } else {
                session.setReminderCount(reminder + 1);
                armReminderTimer(session);
            }
        } finally {
            session.getLock().unlock();
        }
    }

    private void sendSummary(ConversationSession session) {
        session.setState(ConversationState.CONFIRMING);
        session.enqueueMessage(formatter.summary(session.getCurrentOrders()));
        // the count names the reminder that is armed next
        session.setReminderCount(1);
        armReminderTimer(session);
    }

    private void onRemindersExhausted(ConversationSession session) {
        if (!session.hasItems()) {
            restart(session, false);
            return;
        }
        Map<String, Integer> order = session.getCurrentOrders();
        if (exhaustion == ReminderExhaustion.HOLD_PENDING) {
            String groupId = groupIdGenerator.next("pending");
            if (!persistFromCallback(session, order, OrderStatus.PENDING, groupId)) {
                return;
            }
            session.addHeldOrder(new HeldOrder(groupId, order));
            session.enqueueMessage(formatter.held(order));
            clearWorkingOrder(session);
            session.setState(ConversationState.PENDING_CONFIRMATION);
            logger.info("Session {} held order {} as {}", session.getSessionId(), order, groupId);
            return;
        }
        String groupId = groupIdGenerator.next("auto");
        if (!persistFromCallback(session, order, OrderStatus.AUTO_CONFIRMED, groupId)) {
            return;
        }
        session.enqueueMessage(AUTO_CONFIRMED);
        clearWorkingOrder(session);
        session.setState(ConversationState.WAITING_FOR_NEXT);
        logger.info("Session {} auto-confirmed order {} as {}", session.getSessionId(), order, groupId);
    }

    /**
     * Persists from a timer thread. On failure the order stays in the working catalog and
     * the conversation falls back to collecting so the next timeout tries again.
     */
    private boolean persistFromCallback(ConversationSession session, Map<String, Integer> order,
                                        OrderStatus status, String groupId) {
        try {
            orderStore.persist(session.getSessionId(), session.getUserId(), order, status, groupId);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to store {} order for session {}: {}", status.getValue(), session.getSessionId(), e.getMessage(), e);
            session.setState(ConversationState.COLLECTING);
            session.setReminderCount(0);
            armInactivityTimer(session);
            return false;
        }
    }

    private void clearWorkingOrder(ConversationSession session) {
        session.cancelTimer();
        session.resetWorkingCatalog();
        session.setReminderCount(0);
        session.setState(ConversationState.COLLECTING);
    }

    private void armInactivityTimer(ConversationSession session) {
        session.replaceTimer(generation ->
                scheduler.after(inactivityDelay, () -> onInactivityTimeout(session, generation)));
        logger.debug("Armed inactivity timer for session {}", session.getSessionId());
    }

    private void armReminderTimer(ConversationSession session) {
        session.replaceTimer(generation ->
                scheduler.after(reminderDelay, () -> onReminderTimeout(session, generation)));
        logger.debug("Armed reminder {} for session {}", session.getReminderCount(), session.getSessionId());
    }

    private boolean isCancel(String folded) {
        return CANCEL_PHRASES.stream().anyMatch(folded::contains);
    }

    private static Set<String> words(String folded) {
        return new HashSet<>(Arrays.asList(folded.split("\\s+")));
    }

    private static boolean containsAny(Set<String> words, Set<String> candidates) {
        return candidates.stream().anyMatch(words::contains);
    }
}
