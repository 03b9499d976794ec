package com.polpas.orderbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class ConversationSchedulerConfig {

    @Bean("conversationTaskScheduler")
    public ThreadPoolTaskScheduler conversationTaskScheduler(@Value("${orderbot.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("ConversationTimer-");
        scheduler.setRemoveOnCancelPolicy(true); // cancelled reminders should not pile up in the queue
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
