package com.polpas.orderbot.conversation.service;

import com.polpas.orderbot.scheduler.ConversationScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual-time scheduler: tasks run on the calling thread when {@link #advance(Duration)}
 * moves the clock past their due time.
 */
class ManualConversationScheduler implements ConversationScheduler {

    private final List<ScheduledTask> tasks = new ArrayList<>();
    private Duration now = Duration.ZERO;
    private boolean runCancelledTasks;

    @Override
    public Handle after(Duration delay, Runnable task) {
        ScheduledTask scheduled = new ScheduledTask(now.plus(delay), task);
        tasks.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    /**
     * Makes cancelled tasks run anyway, like a timer thread that had already started.
     */
    void runCancelledTasks() {
        this.runCancelledTasks = true;
    }

    void advance(Duration amount) {
        Duration target = now.plus(amount);
        while (true) {
            ScheduledTask next = null;
            for (ScheduledTask task : tasks) {
                if (task.dueAt.compareTo(target) <= 0 && (next == null || task.dueAt.compareTo(next.dueAt) < 0)) {
                    next = task;
                }
            }
            if (next == null) {
                break;
            }
            tasks.remove(next);
            now = next.dueAt;
            if (!next.cancelled || runCancelledTasks) {
                next.task.run();
            }
        }
        now = target;
    }

    void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    long activeTasks() {
        return tasks.stream().filter(task -> !task.cancelled).count();
    }

    private static final class ScheduledTask {
        private final Duration dueAt;
        private final Runnable task;
        private boolean cancelled;

        private ScheduledTask(Duration dueAt, Runnable task) {
            this.dueAt = dueAt;
            this.task = task;
        }
    }
}
