package com.delta.factengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    /**
     * Sized for the widest run a caller may request, with room for cancelled attempts that are
     * still unwinding. An attempt's timeout runs from submission, so it must never sit queued.
     */
    @Bean(name = "fetchAttemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchAttemptExecutor(EngineProperties properties) {
        int size = Math.max(EngineProperties.MAX_CONCURRENCY, properties.getGlobalConcurrency()) * 2;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("fetch-attempt-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(EngineProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
