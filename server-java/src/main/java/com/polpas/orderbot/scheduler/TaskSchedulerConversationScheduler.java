package com.polpas.orderbot.scheduler;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

@Component
public class TaskSchedulerConversationScheduler implements ConversationScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerConversationScheduler(@Qualifier("conversationTaskScheduler") TaskScheduler taskScheduler,
                                              Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public Handle after(Duration delay, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
