package com.aether.core.support;

import com.aether.core.entity.ActorScheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs mailbox drains inline on the calling thread and holds timers until
 * {@link #advance} moves the clock past their due time.
 */
public class ManualActorScheduler implements ActorScheduler {

    private final MutableClock clock;
    private final List<Timer> timers = new ArrayList<>();
    private final List<Runnable> periodic = new ArrayList<>();
    private long order;

    public ManualActorScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void execute(Runnable task) {
        task.run();
    }

    @Override
    public synchronized void schedule(Runnable task, long delayMs) {
        timers.add(new Timer(clock.millis() + Math.max(0, delayMs), order++, task));
    }

    @Override
    public synchronized void scheduleAtFixedRate(Runnable task, long periodMs) {
        periodic.add(task);
    }

    /**
     * Move the clock forward, firing every timer that falls due on the way in due order.
     */
    public void advance(long deltaMillis) {
        long target = clock.millis() + deltaMillis;
        while (true) {
            Optional<Timer> next = nextDue(target);
            if (next.isEmpty()) {
                break;
            }
            Timer timer = next.get();
            if (timer.due() > clock.millis()) {
                clock.set(timer.due());
            }
            timer.task().run();
        }
        clock.set(target);
    }

    public void runPeriodic() {
        List<Runnable> tasks;
        synchronized (this) {
            tasks = List.copyOf(periodic);
        }
        tasks.forEach(Runnable::run);
    }

    public synchronized int pendingTimers() {
        return timers.size();
    }

    private synchronized Optional<Timer> nextDue(long target) {
        Optional<Timer> next = timers.stream()
                .filter(t -> t.due() <= target)
                .min(Comparator.comparingLong(Timer::due).thenComparingLong(Timer::order));
        next.ifPresent(timers::remove);
        return next;
    }

    private record Timer(long due, long order, Runnable task) {}
}
