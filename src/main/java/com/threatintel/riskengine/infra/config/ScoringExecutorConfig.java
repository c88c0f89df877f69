package com.threatintel.riskengine.infra.config;

import com.threatintel.riskengine.domain.service.correlation.CorrelationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ScoringExecutorConfig {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    @Bean(name = "scoringExecutor", destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(CorrelationProperties properties) {
        int threads = Math.max(1, properties.getScoringThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "record-scoring-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
