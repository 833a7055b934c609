package com.aether.core.metrics;

import com.aether.core.model.AbortReason;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.CommandType;
import com.aether.core.model.MissionPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the agent runtime.
 */
@Service
public class AetherMetrics {

    private final MeterRegistry registry;

    public AetherMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEventReceived(String eventType) {
        Counter.builder("aether.events.received")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordEvent(String eventType) {
        Counter.builder("aether.events.processed")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordEventFailure(String eventType) {
        Counter.builder("aether.events.failed")
                .description("Events whose handler threw; the actor keeps running")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordTransition(AgentLifecycleState from, AgentLifecycleState to) {
        Counter.builder("aether.lifecycle.transitions")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    public void recordFalseStart() {
        Counter.builder("aether.sessions.false_starts")
                .description("Armings reverted before a session was confirmed")
                .register(registry)
                .increment();
    }

    public void recordAssignment(AssignmentResult.Outcome outcome) {
        Counter.builder("aether.assignments")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordMissionResult(MissionPhase phase, AbortReason reason) {
        Counter.builder("aether.missions.total")
                .tag("phase", phase.name())
                .tag("reason", reason != null ? reason.name() : "none")
                .register(registry)
                .increment();
    }

    public void recordCommandRetry(CommandType type) {
        Counter.builder("aether.commands.retries")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordCompaction(long ms) {
        Timer.builder("aether.compaction.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a checkpoint that could not be persisted. The superseded segment is kept
     * and compaction is retried on the next trigger.
     */
    public void recordCompactionFailure() {
        Counter.builder("aether.compaction.failures")
                .register(registry)
                .increment();
    }

    /**
     * @param matched whether the query produced a candidate
     */
    public void recordDispatchQuery(boolean matched) {
        Counter.builder("aether.dispatch.queries")
                .tag("result", matched ? "match" : "none")
                .register(registry)
                .increment();
    }
}
