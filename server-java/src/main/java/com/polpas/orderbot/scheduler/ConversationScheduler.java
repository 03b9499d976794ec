package com.polpas.orderbot.scheduler;

import java.time.Duration;

/**
 * Deferred execution for conversation timers. Implementations must tolerate a task that
 * was already starting when {@link Handle#cancel()} is called; the task itself re-checks
 * whether it is still wanted.
 */
public interface ConversationScheduler {

    Handle after(Duration delay, Runnable task);

    interface Handle {
        void cancel();
    }
}
