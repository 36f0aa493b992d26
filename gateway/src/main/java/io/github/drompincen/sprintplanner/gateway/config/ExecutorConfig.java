package io.github.drompincen.sprintplanner.gateway.config;

import io.github.drompincen.sprintplanner.runtime.sync.SyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /** Bounded to one batch so a single aggregation never has more fetches in flight. */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService epicFetchExecutor(SyncProperties syncProperties) {
        return Executors.newFixedThreadPool(Math.max(1, syncProperties.getEpicBatchSize()),
                namedDaemon("epic-fetch-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService syncPipelineExecutor() {
        return Executors.newFixedThreadPool(4, namedDaemon("sync-pipeline-"));
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
