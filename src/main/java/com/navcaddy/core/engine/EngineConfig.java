package com.navcaddy.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    /**
     * Runs blocking language model calls so a turn can stop waiting on timeout or cancellation.
     */
    @Bean(name = "modelCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService modelCallExecutor(SessionProperties properties) {
        return Executors.newFixedThreadPool(properties.getModelThreads(), daemonThreads("navcaddy-model-"));
    }

    /**
     * Runs conversation turns submitted through {@link ConversationEngine#submit}.
     */
    @Bean(name = "conversationExecutor", destroyMethod = "shutdown")
    public ExecutorService conversationExecutor(SessionProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), daemonThreads("navcaddy-turn-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
