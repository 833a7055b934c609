package com.aether.core.entity;

/**
 * Threads that run entity actors and their timers.
 */
public interface ActorScheduler {

    /** Run a mailbox drain. */
    void execute(Runnable task);

    /** Run {@code task} once after {@code delayMs}. */
    void schedule(Runnable task, long delayMs);

    /** Run {@code task} every {@code periodMs}, first after one period. */
    void scheduleAtFixedRate(Runnable task, long periodMs);
}
