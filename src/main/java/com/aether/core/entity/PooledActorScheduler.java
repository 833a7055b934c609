package com.aether.core.entity;

import com.aether.core.config.AetherProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed worker pool shared by all actors plus one timer thread. An actor occupies a
 * worker only while it has events queued.
 */
@Component
public class PooledActorScheduler implements ActorScheduler {

    private static final Logger log = LoggerFactory.getLogger(PooledActorScheduler.class);

    private final ExecutorService workers;
    private final ScheduledExecutorService timers;

    public PooledActorScheduler(AetherProperties properties) {
        int threads = Math.max(1, properties.getRuntime().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "aether-actor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "aether-timers");
            t.setDaemon(true);
            return t;
        });
        log.info("Actor scheduler started ({} worker threads)", threads);
    }

    @Override
    public void execute(Runnable task) {
        workers.execute(task);
    }

    @Override
    public void schedule(Runnable task, long delayMs) {
        timers.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void scheduleAtFixedRate(Runnable task, long periodMs) {
        timers.scheduleAtFixedRate(task, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Actor scheduler stopped");
    }
}
