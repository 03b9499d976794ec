package com.polpas.orderbot.conversation.model;

import com.polpas.orderbot.scheduler.ConversationScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Conversation state for a single customer. Transitions are applied by
 * {@code ConversationStateMachine} while holding {@link #getLock()}; readers may look at
 * the working catalog and order lists without the lock.
 */
public class ConversationSession {

    private final String sessionId;
    private final String userId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Queue<String> outgoingMessages = new ConcurrentLinkedQueue<>();
    private final List<Map<String, Integer>> confirmedOrders = new CopyOnWriteArrayList<>();
    private final List<HeldOrder> heldOrders = new CopyOnWriteArrayList<>();

    private volatile ConversationState state = ConversationState.WAITING_FOR_NEXT;
    private volatile WorkingCatalog workingCatalog;
    private volatile int reminderCount;
    private volatile Instant lastActivity;

    private ConversationScheduler.Handle activeTimer;
    private long timerGeneration;

    public ConversationSession(String sessionId, String userId, WorkingCatalog workingCatalog, Instant openedAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.workingCatalog = workingCatalog.reset();
        this.lastActivity = openedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public ConversationState getState() {
        return state;
    }

    public void setState(ConversationState state) {
        this.state = state;
    }

    public WorkingCatalog getWorkingCatalog() {
        return workingCatalog;
    }

    public void setWorkingCatalog(WorkingCatalog workingCatalog) {
        this.workingCatalog = workingCatalog;
    }

    public void resetWorkingCatalog() {
        this.workingCatalog = workingCatalog.reset();
    }

    public boolean hasItems() {
        return workingCatalog.hasItems();
    }

    public Map<String, Integer> getCurrentOrders() {
        return workingCatalog.currentOrders();
    }

    public int getReminderCount() {
        return reminderCount;
    }

    public void setReminderCount(int reminderCount) {
        this.reminderCount = reminderCount;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public List<Map<String, Integer>> getConfirmedOrders() {
        return Collections.unmodifiableList(confirmedOrders);
    }

    public void addConfirmedOrder(Map<String, Integer> order) {
        confirmedOrders.add(Map.copyOf(order));
    }

    public List<HeldOrder> getHeldOrders() {
        return Collections.unmodifiableList(heldOrders);
    }

    public List<Map<String, Integer>> getPendingOrders() {
        List<Map<String, Integer>> pending = new ArrayList<>();
        for (HeldOrder held : heldOrders) {
            pending.add(held.items());
        }
        return pending;
    }

    public void addHeldOrder(HeldOrder order) {
        heldOrders.add(order);
    }

    public void clearHeldOrders() {
        heldOrders.clear();
    }

    public void enqueueMessage(String message) {
        outgoingMessages.add(message);
    }

    public Optional<String> pollMessage() {
        return Optional.ofNullable(outgoingMessages.poll());
    }

    /**
     * Cancels the armed timer, if any, and arms the one produced by {@code armer}. The
     * armer receives the generation the new timer must present when it fires.
     * Callers hold the session lock.
     */
    public void replaceTimer(LongFunction<ConversationScheduler.Handle> armer) {
        cancelTimer();
        activeTimer = armer.apply(timerGeneration);
    }

    public void cancelTimer() {
        if (activeTimer != null) {
            activeTimer.cancel();
            activeTimer = null;
        }
        timerGeneration++;
    }

    public boolean isCurrentTimer(long generation) {
        return activeTimer != null && generation == timerGeneration;
    }

    /**
     * Forgets the handle of a timer that has just fired so it is not cancelled later.
     */
    public void timerFired() {
        activeTimer = null;
        timerGeneration++;
    }

    public boolean hasActiveTimer() {
        return activeTimer != null;
    }
}
