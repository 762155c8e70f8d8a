package com.sashkomusic.catalogingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class StorageExecutorConfig {

    /**
     * Runs remote blob writes so the caller can bound them with a timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService remoteStorageExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "remote-storage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
