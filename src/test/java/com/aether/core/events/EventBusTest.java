package com.aether.core.events;

import com.aether.core.entity.UnknownAgentException;
import com.aether.core.model.GeoPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static AgentEvent telemetry(String agentId, long timestamp) {
        return TelemetryUpdate.position(agentId, timestamp, new GeoPoint(47.0, 8.0, 0.0), 90.0, false, 3);
    }

    /** Mailbox that records what it receives and replies with the event itself. */
    private static EventBus.Mailbox recording(List<AgentEvent> received) {
        return event -> {
            received.add(event);
            return CompletableFuture.completedFuture(event);
        };
    }

    // -- Routing ------------------------------------------------------------

    @Nested
    @DisplayName("routing")
    class RoutingTests {

        @Test
        @DisplayName("delivers events to the mailbox that owns the agent")
        void deliversToOwner() {
            List<AgentEvent> d1 = new ArrayList<>();
            List<AgentEvent> d2 = new ArrayList<>();
            eventBus.register("D1", recording(d1));
            eventBus.register("D2", recording(d2));

            assertTrue(eventBus.publish(telemetry("D1", 1)));

            assertEquals(1, d1.size());
            assertTrue(d2.isEmpty());
        }

        @Test
        @DisplayName("keeps per-agent publish order")
        void keepsOrder() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.register("D1", recording(received));

            eventBus.publish(telemetry("D1", 1));
            eventBus.publish(new ConnectivityChange("D1", 2, false));
            eventBus.publish(telemetry("D1", 3));

            assertEquals(List.of(1L, 2L, 3L), received.stream().map(AgentEvent::timestamp).toList());
        }

        @Test
        @DisplayName("publish for an unknown agent drops the event")
        void publishUnknownDropped() {
            assertFalse(eventBus.publish(telemetry("ghost", 1)));
        }

        @Test
        @DisplayName("request for an unknown agent fails with UnknownAgentException")
        void requestUnknownFails() {
            CompletableFuture<Object> reply = eventBus.request(telemetry("ghost", 1));

            var thrown = assertThrows(ExecutionException.class, reply::get);
            assertInstanceOf(UnknownAgentException.class, thrown.getCause());
        }

        @Test
        @DisplayName("request returns the mailbox reply")
        void requestReturnsReply() throws Exception {
            eventBus.register("D1", event -> CompletableFuture.completedFuture("done"));

            assertEquals("done", eventBus.request(telemetry("D1", 1)).get());
        }
    }

    // -- Registration -------------------------------------------------------

    @Nested
    @DisplayName("registration")
    class RegistrationTests {

        @Test
        @DisplayName("a second owner for the same agent is refused")
        void singleOwner() {
            eventBus.register("D1", recording(new ArrayList<>()));

            assertThrows(IllegalStateException.class, () -> eventBus.register("D1", recording(new ArrayList<>())));
        }

        @Test
        @DisplayName("unsubscribing removes the owner")
        void unsubscribeRemovesOwner() {
            List<AgentEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.register("D1", recording(received));

            subscription.unsubscribe();

            assertFalse(eventBus.isRegistered("D1"));
            assertFalse(eventBus.publish(telemetry("D1", 1)));
            assertTrue(received.isEmpty());
        }
    }

    // -- Global subscription ------------------------------------------------

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber sees routed events of every agent")
        void seesAllAgents() {
            List<AgentEvent> seen = new ArrayList<>();
            eventBus.register("D1", recording(new ArrayList<>()));
            eventBus.register("D2", recording(new ArrayList<>()));
            eventBus.subscribeAll(seen::add);

            eventBus.publish(telemetry("D1", 1));
            eventBus.request(telemetry("D2", 2));
            eventBus.publish(telemetry("ghost", 3));

            assertEquals(List.of("D1", "D2"), seen.stream().map(AgentEvent::agentId).toList());
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery")
        void subscriberExceptionIsolated() {
            List<AgentEvent> received = new ArrayList<>();
            eventBus.register("D1", recording(received));
            eventBus.subscribeAll(e -> {
                throw new RuntimeException("boom");
            });

            assertTrue(eventBus.publish(telemetry("D1", 1)));
            assertEquals(1, received.size());
        }
    }

    // -- Concurrency --------------------------------------------------------

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<AgentEvent> received = new CopyOnWriteArrayList<>();
            eventBus.register("D1", event -> {
                received.add(event);
                return CompletableFuture.completedFuture(null);
            });

            int threadCount = 10;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(telemetry("D1", i));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }
    }

    @Test
    @DisplayName("emergency stop carries emergency priority, everything else normal")
    void priorities() {
        assertEquals(EventPriority.EMERGENCY, new OperatorSignal.EmergencyStop("D1", 1).priority());
        assertEquals(EventPriority.NORMAL, new OperatorSignal.ClearError("D1", 1).priority());
        assertEquals(EventPriority.NORMAL, telemetry("D1", 1).priority());
    }
}
