package com.aether.core.fleet;

import com.aether.core.geo.GeoMath;
import com.aether.core.metrics.AetherMetrics;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.DispatchMatch;
import com.aether.core.model.DispatchQuery;
import com.aether.core.model.GeoPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FleetDispatcherTest {

    private static final GeoPoint P = new GeoPoint(47.3977, 8.5456, 0.0);

    private FleetIndex index;
    private SimpleMeterRegistry registry;
    private FleetDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        index = new FleetIndex();
        registry = new SimpleMeterRegistry();
        dispatcher = new FleetDispatcher(index, new AetherMetrics(registry));
    }

    private void publish(String id, AgentLifecycleState state, GeoPoint position, AgentAttributes attributes) {
        index.publish(new AgentSnapshot(id, attributes, state, position, position, 90.0, false, 3, null,
                state != AgentLifecycleState.OFFLINE, null, null, null, 0L, 1L));
    }

    private void idle(String id, GeoPoint position, String... sensors) {
        publish(id, AgentLifecycleState.ONLINE_IDLE, position,
                new AgentAttributes(Set.of(sensors), null, null, null, null));
    }

    @Test
    @DisplayName("returns the closer of the two lidar-equipped idle agents")
    void closestLidarAgent() {
        idle("A", GeoMath.offset(P, 900, 0), "lidar");
        idle("B", GeoMath.offset(P, 50, 0), "camera");
        idle("C", GeoMath.offset(P, 300, 0), "lidar", "camera");

        Optional<DispatchMatch> match = dispatcher.find(DispatchQuery.idleWith(Set.of("lidar"), P));

        assertEquals("C", match.orElseThrow().agentId());
        assertEquals(300.0, match.get().distanceMeters(), 1.0);
    }

    @Test
    @DisplayName("equal distances are broken by agent id")
    void tieBreak() {
        GeoPoint same = GeoMath.offset(P, 100, 100);
        idle("zulu", same);
        idle("alpha", same);
        idle("mike", same);

        DispatchQuery query = DispatchQuery.idleWith(Set.of(), P);

        for (int i = 0; i < 5; i++) {
            assertEquals("alpha", dispatcher.find(query).orElseThrow().agentId());
        }
        assertEquals(List.of("alpha", "mike", "zulu"),
                dispatcher.rank(query).stream().map(DispatchMatch::agentId).toList());
    }

    @Test
    @DisplayName("agents without a position rank after located ones")
    void unknownPositionLast() {
        idle("A", null);
        idle("B", GeoMath.offset(P, 2_000, 0));

        assertEquals(List.of("B", "A"),
                dispatcher.rank(DispatchQuery.idleWith(Set.of(), P)).stream().map(DispatchMatch::agentId).toList());
    }

    @Test
    @DisplayName("no candidate is reported as empty and counted")
    void noCandidate() {
        idle("A", P, "camera");

        assertTrue(dispatcher.find(DispatchQuery.idleWith(Set.of("lidar"), P)).isEmpty());
        assertEquals(1.0, registry.get("aether.dispatch.queries").tag("result", "none").counter().count());
    }

    @Nested
    @DisplayName("filters")
    class Filters {

        @Test
        @DisplayName("lifecycle state must match")
        void state() {
            publish("busy", AgentLifecycleState.IN_MISSION, P, new AgentAttributes(null, null, null, null, null));
            publish("off", AgentLifecycleState.OFFLINE, P, new AgentAttributes(null, null, null, null, null));

            assertTrue(dispatcher.find(DispatchQuery.idleWith(Set.of(), P)).isEmpty());

            var offline = new DispatchQuery(null, AgentLifecycleState.OFFLINE, null, P, null, null, null);
            assertEquals("off", dispatcher.find(offline).orElseThrow().agentId());
        }

        @Test
        @DisplayName("service area, payload and range")
        void attributes() {
            publish("north-light", AgentLifecycleState.ONLINE_IDLE, P,
                    new AgentAttributes(null, 5_000.0, 0.5, "north", null));
            publish("north-heavy", AgentLifecycleState.ONLINE_IDLE, GeoMath.offset(P, 10, 0),
                    new AgentAttributes(null, 5_000.0, 4.0, "north", null));
            publish("south-heavy", AgentLifecycleState.ONLINE_IDLE, P,
                    new AgentAttributes(null, 20_000.0, 4.0, "south", null));

            var heavyNorth = new DispatchQuery(null, null, "north", P, 2.0, null, null);
            assertEquals("north-heavy", dispatcher.find(heavyNorth).orElseThrow().agentId());

            var longRange = new DispatchQuery(null, null, null, P, null, 10_000.0, null);
            assertEquals("south-heavy", dispatcher.find(longRange).orElseThrow().agentId());
        }

        @Test
        @DisplayName("agents farther than their own range are skipped")
        void outOfRange() {
            publish("short", AgentLifecycleState.ONLINE_IDLE, GeoMath.offset(P, 1_500, 0),
                    new AgentAttributes(null, 1_000.0, null, null, null));

            assertTrue(dispatcher.find(DispatchQuery.idleWith(Set.of(), P)).isEmpty());
            assertTrue(dispatcher.find(DispatchQuery.idleWith(Set.of(), null)).isPresent(),
                    "no reference point, no distance check");
        }

        @Test
        @DisplayName("excluded agents are skipped")
        void excluded() {
            idle("A", P);
            idle("B", GeoMath.offset(P, 100, 0));

            DispatchQuery query = DispatchQuery.idleWith(Set.of(), P).excluding("A");

            assertEquals("B", dispatcher.find(query).orElseThrow().agentId());
            assertEquals(Set.of("A"), query.excludedAgentIds());
        }
    }
}
