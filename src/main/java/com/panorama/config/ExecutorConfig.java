package com.panorama.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for per-image projection and feature detection.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "stitchingExecutor", destroyMethod = "shutdown")
    public ExecutorService stitchingExecutor(PanoramaProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread thread = new Thread(r, "stitch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getThreads()), factory);
    }
}
