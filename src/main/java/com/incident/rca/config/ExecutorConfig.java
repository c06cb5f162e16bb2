package com.incident.rca.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Shared by analyzer tasks and reasoning backend calls. Threads are daemons so a stuck
     * backend call never blocks shutdown.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(AnalysisConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, config.getPipeline().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "rca-pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
