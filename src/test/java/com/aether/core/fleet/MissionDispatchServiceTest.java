package com.aether.core.fleet;

import com.aether.core.config.AetherProperties;
import com.aether.core.entity.FleetRegistry;
import com.aether.core.geo.GeoMath;
import com.aether.core.metrics.AetherMetrics;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.DispatchQuery;
import com.aether.core.model.GeoPoint;
import com.aether.core.model.MissionPlan;
import com.aether.core.model.RouteStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MissionDispatchServiceTest {

    private static final GeoPoint P = new GeoPoint(47.3977, 8.5456, 0.0);
    private static final MissionPlan PLAN = new MissionPlan("P-1", null, null,
            List.of(new RouteStep.Takeoff(20.0), new RouteStep.Land()), null);

    private FleetIndex index;
    private FleetRegistry registry;
    private MissionDispatchService service;

    @BeforeEach
    void setUp() {
        index = new FleetIndex();
        registry = mock(FleetRegistry.class);
        var properties = new AetherProperties();
        properties.getDispatch().setMaxAttempts(3);
        var dispatcher = new FleetDispatcher(index, new AetherMetrics(new SimpleMeterRegistry()));
        service = new MissionDispatchService(dispatcher, registry, properties);
    }

    private void idle(String id, double northMeters) {
        GeoPoint position = GeoMath.offset(P, northMeters, 0);
        index.publish(new AgentSnapshot(id, new AgentAttributes(Set.of("camera"), null, null, null, null),
                AgentLifecycleState.ONLINE_IDLE, position, position, 90.0, false, 3, null, true,
                null, null, null, 0L, 1L));
    }

    @Test
    @DisplayName("assigns the best candidate")
    void assignsBest() {
        idle("A", 100);
        idle("B", 500);
        when(registry.assign("A", PLAN)).thenReturn(AssignmentResult.accepted("MSN-1"));

        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("camera"), P), PLAN);

        assertTrue(outcome.isAssigned());
        assertEquals("A", outcome.agentId());
        assertEquals(1, outcome.attempts());
        verify(registry, never()).assign(eq("B"), any());
    }

    @Test
    @DisplayName("a lost race moves on to the next candidate")
    void retriesNextCandidate() {
        idle("A", 100);
        idle("B", 500);
        when(registry.assign("A", PLAN)).thenReturn(AssignmentResult.busy());
        when(registry.assign("B", PLAN)).thenReturn(AssignmentResult.accepted("MSN-2"));

        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("camera"), P), PLAN);

        assertTrue(outcome.isAssigned());
        assertEquals("B", outcome.agentId());
        assertEquals("MSN-2", outcome.result().missionId());
        assertEquals(2, outcome.attempts());
    }

    @Test
    @DisplayName("the last answer is reported when every candidate is taken")
    void allTaken() {
        idle("A", 100);
        idle("B", 500);
        when(registry.assign("A", PLAN)).thenReturn(AssignmentResult.busy());
        when(registry.assign("B", PLAN)).thenReturn(AssignmentResult.unreachable());

        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("camera"), P), PLAN);

        assertFalse(outcome.isAssigned());
        assertEquals("B", outcome.agentId());
        assertEquals(AssignmentResult.Outcome.UNREACHABLE, outcome.result().outcome());
    }

    @Test
    @DisplayName("attempts are capped")
    void attemptsCapped() {
        for (int i = 0; i < 5; i++) {
            idle("A" + i, 100 * (i + 1));
            when(registry.assign("A" + i, PLAN)).thenReturn(AssignmentResult.busy());
        }

        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("camera"), P), PLAN);

        assertEquals(3, outcome.attempts());
        assertEquals("A2", outcome.agentId());
        verify(registry, never()).assign(eq("A3"), any());
    }

    @Test
    @DisplayName("a constraint violation is final")
    void violationIsFinal() {
        idle("A", 100);
        idle("B", 500);
        when(registry.assign("A", PLAN)).thenReturn(AssignmentResult.violation("battery 20.0% below required 50.0%"));

        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("camera"), P), PLAN);

        assertEquals(AssignmentResult.Outcome.CONSTRAINT_VIOLATION, outcome.result().outcome());
        verify(registry, never()).assign(eq("B"), any());
    }

    @Test
    @DisplayName("no candidate at all")
    void noCandidate() {
        DispatchOutcome outcome = service.dispatch(DispatchQuery.idleWith(Set.of("lidar"), P), PLAN);

        assertNull(outcome.agentId());
        assertNull(outcome.result());
        assertEquals(0, outcome.attempts());
    }
}
