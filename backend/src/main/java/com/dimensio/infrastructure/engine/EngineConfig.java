package com.dimensio.infrastructure.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class EngineConfig {

    @Value("${engine.parallelism:1}")
    private int parallelism;

    /**
     * Workers for the matcher tasks of a pass. With a parallelism of 1 passes
     * run on the calling thread and this executor is never used.
     */
    @Bean(name = "engineExecutor", destroyMethod = "")
    public Executor engineExecutor() {
        if (parallelism <= 1) {
            return Runnable::run;
        }
        log.info("[Engine] Matcher pool with {} workers", parallelism);
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "engine-matcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return pool;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
