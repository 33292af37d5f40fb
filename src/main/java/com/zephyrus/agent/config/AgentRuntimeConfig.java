package com.zephyrus.agent.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: time source, thread pools and the HTTP client
 * used by the oracle and blockchain gateway clients.
 */
@Configuration
public class AgentRuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per in-flight run; a slow agent never holds up another.
     */
    @Bean(name = "agentWorkerPool", destroyMethod = "shutdown")
    public ExecutorService agentWorkerPool() {
        return Executors.newCachedThreadPool(named("agent-run-"));
    }

    @Bean(name = "collaboratorCallPool", destroyMethod = "shutdownNow")
    public ExecutorService collaboratorCallPool() {
        return Executors.newCachedThreadPool(named("agent-call-"));
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${agent.execution.call-timeout-ms:30000}") long callTimeoutMillis) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofMillis(callTimeoutMillis))
            .build();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
