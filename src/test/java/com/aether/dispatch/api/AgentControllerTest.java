package com.aether.dispatch.api;

import com.aether.core.entity.AgentAlreadyEnrolledException;
import com.aether.core.entity.FleetRegistry;
import com.aether.core.entity.SignalTimeoutException;
import com.aether.core.entity.UnknownAgentException;
import com.aether.core.events.AgentEvent;
import com.aether.core.events.ConnectivityChange;
import com.aether.core.events.EventBus;
import com.aether.core.events.TelemetryUpdate;
import com.aether.core.model.AgentAttributes;
import com.aether.core.model.AgentLifecycleState;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.MissionPlan;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryQueryService;
import com.aether.core.persistence.LoggedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@Import(AgentControllerTest.FixedClock.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AgentControllerTest {

    private static final String PLAN_JSON = """
            {"plan_id":"P-1",
             "constraints":{"min_battery_start":50.0,"required_sensors":["lidar"]},
             "geofence":{"max_altitude":120.0},
             "route":[{"type":"TAKEOFF","altitude":30.0},
                      {"type":"WAYPOINT","target":{"latitude":47.4,"longitude":8.55,"altitude":30.0}},
                      {"type":"LAND"}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FleetRegistry registry;

    @MockitoBean
    private EventBus eventBus;

    @MockitoBean
    private HistoryQueryService historyQuery;

    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        }
    }

    private static AgentSnapshot agent(String id, AgentLifecycleState state) {
        return new AgentSnapshot(id, new AgentAttributes(Set.of("lidar"), 5_000.0, null, "north", null),
                state, null, null, 88.0, false, 3, null, state != AgentLifecycleState.OFFLINE,
                null, null, null, 0L, 4L);
    }

    // ── Enrollment ───────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/agents")
    class Enroll {

        @Test
        @DisplayName("returns 201 with the enrolled agent")
        void enroll() throws Exception {
            when(registry.enroll(eq("D1"), any())).thenReturn(agent("D1", AgentLifecycleState.OFFLINE));

            mockMvc.perform(post("/api/v1/agents")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"agent_id":"D1","sensors":["lidar"],"max_range_meters":5000,"service_area":"north"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.agentId").value("D1"))
                    .andExpect(jsonPath("$.lifecycleState").value("OFFLINE"));

            ArgumentCaptor<AgentAttributes> attributes = ArgumentCaptor.forClass(AgentAttributes.class);
            verify(registry).enroll(eq("D1"), attributes.capture());
            assertEquals(Set.of("lidar"), attributes.getValue().sensors());
            assertEquals(5_000.0, attributes.getValue().maxRangeMeters());
            assertEquals("north", attributes.getValue().serviceArea());
        }

        @Test
        @DisplayName("missing agent_id returns 400")
        void missingId() throws Exception {
            mockMvc.perform(post("/api/v1/agents")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"sensors\":[]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("agent_id")));
        }

        @Test
        @DisplayName("duplicate enrollment returns 409")
        void duplicate() throws Exception {
            when(registry.enroll(eq("D1"), any())).thenThrow(new AgentAlreadyEnrolledException("D1"));

            mockMvc.perform(post("/api/v1/agents")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"agent_id\":\"D1\"}"))
                    .andExpect(status().isConflict());
        }
    }

    // ── Queries ──────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /agents lists the fleet")
    void listAgents() throws Exception {
        when(registry.list()).thenReturn(List.of(
                agent("A", AgentLifecycleState.ONLINE_IDLE), agent("B", AgentLifecycleState.OFFLINE)));

        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].agentId").value("A"));
    }

    @Test
    @DisplayName("GET /agents/{id} for an unknown agent returns 404")
    void unknownAgent() throws Exception {
        when(registry.require("ghost")).thenThrow(new UnknownAgentException("ghost"));

        mockMvc.perform(get("/api/v1/agents/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("ghost")));
    }

    @Test
    @DisplayName("DELETE /agents/{id} decommissions")
    void decommission() throws Exception {
        mockMvc.perform(delete("/api/v1/agents/D1"))
                .andExpect(status().isNoContent());
        verify(registry).decommission("D1");
    }

    @Test
    @DisplayName("DELETE /agents/{id} for an unknown agent returns 404")
    void decommissionUnknown() throws Exception {
        doThrow(new UnknownAgentException("ghost")).when(registry).decommission("ghost");

        mockMvc.perform(delete("/api/v1/agents/ghost"))
                .andExpect(status().isNotFound());
    }

    // ── Telemetry and connectivity ───────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/agents/{id}/telemetry")
    class Telemetry {

        @Test
        @DisplayName("queues the sample and answers 202")
        void async() throws Exception {
            when(eventBus.publish(any())).thenReturn(true);

            mockMvc.perform(post("/api/v1/agents/D1/telemetry")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"kind":"POSITION","position":{"latitude":47.4,"longitude":8.5,"altitude":12.0},
                                     "battery":81.5,"armed":true,"gps_fix":3}
                                    """))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.agent_id").value("D1"));

            ArgumentCaptor<AgentEvent> event = ArgumentCaptor.forClass(AgentEvent.class);
            verify(eventBus).publish(event.capture());
            TelemetryUpdate update = (TelemetryUpdate) event.getValue();
            assertEquals(1_700_000_000_000L, update.timestamp(), "receipt time stands in for a missing timestamp");
            assertEquals(81.5, update.battery());
            assertEquals(Boolean.TRUE, update.armed());
            assertEquals(3, update.gpsFix());
            assertNull(update.windSpeed());
        }

        @Test
        @DisplayName("unknown agent returns 404")
        void unknown() throws Exception {
            when(eventBus.publish(any())).thenReturn(false);

            mockMvc.perform(post("/api/v1/agents/ghost/telemetry")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"battery\":50}"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("sync=true returns the updated agent")
        void sync() throws Exception {
            when(registry.ingest(any())).thenReturn(agent("D1", AgentLifecycleState.ONLINE_ARMED));

            mockMvc.perform(post("/api/v1/agents/D1/telemetry?sync=true")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"timestamp\":42,\"armed\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.lifecycleState").value("ONLINE_ARMED"));

            ArgumentCaptor<AgentEvent> event = ArgumentCaptor.forClass(AgentEvent.class);
            verify(registry).ingest(event.capture());
            assertEquals(42L, event.getValue().timestamp());
        }

        @Test
        @DisplayName("a slow actor answers 504")
        void timeout() throws Exception {
            when(registry.ingest(any())).thenThrow(new SignalTimeoutException("Agent D1 did not answer within 5000 ms"));

            mockMvc.perform(post("/api/v1/agents/D1/telemetry?sync=true")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isGatewayTimeout());
        }
    }

    @Test
    @DisplayName("POST /connectivity feeds a connectivity change")
    void connectivity() throws Exception {
        when(registry.ingest(any())).thenReturn(agent("D1", AgentLifecycleState.ONLINE_IDLE));

        mockMvc.perform(post("/api/v1/agents/D1/connectivity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connected\":true}"))
                .andExpect(status().isOk());

        verify(registry).ingest(new ConnectivityChange("D1", 1_700_000_000_000L, true));
    }

    // ── Missions and drafts ──────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/agents/{id}/missions")
    class Assign {

        @Test
        @DisplayName("accepted assignment returns 202 with the mission id")
        void accepted() throws Exception {
            when(registry.assign(eq("D1"), any())).thenReturn(AssignmentResult.accepted("MSN-1"));

            mockMvc.perform(post("/api/v1/agents/D1/missions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(PLAN_JSON))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.outcome").value("ACCEPTED"))
                    .andExpect(jsonPath("$.missionId").value("MSN-1"));

            ArgumentCaptor<MissionPlan> plan = ArgumentCaptor.forClass(MissionPlan.class);
            verify(registry).assign(eq("D1"), plan.capture());
            assertEquals("P-1", plan.getValue().planId());
            assertEquals(3, plan.getValue().route().size());
            assertEquals(50.0, plan.getValue().constraints().minBatteryStart());
            assertEquals(120.0, plan.getValue().geofence().maxAltitude());
        }

        @Test
        @DisplayName("busy agent returns 409")
        void busy() throws Exception {
            when(registry.assign(eq("D1"), any())).thenReturn(AssignmentResult.busy());

            mockMvc.perform(post("/api/v1/agents/D1/missions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(PLAN_JSON))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.outcome").value("BUSY"));
        }

        @Test
        @DisplayName("offline agent returns 503")
        void unreachable() throws Exception {
            when(registry.assign(eq("D1"), any())).thenReturn(AssignmentResult.unreachable());

            mockMvc.perform(post("/api/v1/agents/D1/missions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(PLAN_JSON))
                    .andExpect(status().isServiceUnavailable());
        }

        @Test
        @DisplayName("constraint violation returns 422 with the reason")
        void violation() throws Exception {
            when(registry.assign(eq("D1"), any()))
                    .thenReturn(AssignmentResult.violation("battery 40.0% below required 50.0%"));

            mockMvc.perform(post("/api/v1/agents/D1/missions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(PLAN_JSON))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.reason", containsString("battery")));
        }
    }

    @Nested
    @DisplayName("drafts")
    class Drafts {

        @Test
        @DisplayName("propose stores a draft and returns its id")
        void propose() throws Exception {
            when(registry.proposePlan(eq("D1"), isNull(), any())).thenReturn("DRF-0000ABCD");

            mockMvc.perform(post("/api/v1/agents/D1/drafts")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"plan\":" + PLAN_JSON + "}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.draft_id").value("DRF-0000ABCD"));
        }

        @Test
        @DisplayName("propose without a plan returns 400")
        void proposeWithoutPlan() throws Exception {
            mockMvc.perform(post("/api/v1/agents/D1/drafts")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"draft_id\":\"X\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("approve assigns the draft")
        void approve() throws Exception {
            when(registry.approvePlan("D1", "DRF-1")).thenReturn(AssignmentResult.accepted("MSN-9"));

            mockMvc.perform(post("/api/v1/agents/D1/drafts/DRF-1/approve"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.missionId").value("MSN-9"));
        }

        @Test
        @DisplayName("reject forwards the feedback")
        void reject() throws Exception {
            when(registry.rejectPlan("D1", "DRF-1", "too close to the airport")).thenReturn(true);

            mockMvc.perform(post("/api/v1/agents/D1/drafts/DRF-1/reject")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"feedback\":\"too close to the airport\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("REJECTED"));
        }

        @Test
        @DisplayName("rejecting an unknown draft returns 404")
        void rejectUnknown() throws Exception {
            when(registry.rejectPlan(anyString(), anyString(), any())).thenReturn(false);

            mockMvc.perform(post("/api/v1/agents/D1/drafts/nope/reject"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error", containsString("nope")));
        }
    }

    @Test
    @DisplayName("POST /emergency-stop returns the stopped agent")
    void emergencyStop() throws Exception {
        when(registry.emergencyStop("D1")).thenReturn(agent("D1", AgentLifecycleState.ONLINE_ARMED));

        mockMvc.perform(post("/api/v1/agents/D1/emergency-stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agentId").value("D1"));
    }

    @Test
    @DisplayName("POST /clear-error returns the recovered agent")
    void clearError() throws Exception {
        when(registry.clearError("D1")).thenReturn(agent("D1", AgentLifecycleState.ONLINE_IDLE));

        mockMvc.perform(post("/api/v1/agents/D1/clear-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lifecycleState").value("ONLINE_IDLE"));
    }

    // ── History ──────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /history shows the checkpoint and pending events")
    void history() throws Exception {
        Instant taken = Instant.parse("2026-03-01T10:00:00Z");
        when(historyQuery.latestCheckpoint("D1")).thenReturn(Optional.of(new EntityCheckpoint("D1", 10, taken,
                agent("D1", AgentLifecycleState.ONLINE_IDLE), null, null, null, null, Map.of(), null)));
        when(historyQuery.pendingEvents("D1")).thenReturn(List.of(
                new LoggedEvent("D1", 11, new ConnectivityChange("D1", 5_000L, false), taken)));
        when(historyQuery.segmentSize("D1")).thenReturn(1L);

        mockMvc.perform(get("/api/v1/agents/D1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpoint_sequence").value(10))
                .andExpect(jsonPath("$.segment_size").value(1))
                .andExpect(jsonPath("$.pending_events[0].sequence").value(11))
                .andExpect(jsonPath("$.pending_events[0].type").value("ConnectivityChange"));
    }

    @Test
    @DisplayName("GET /history without a checkpoint returns 404")
    void historyUnknown() throws Exception {
        when(historyQuery.latestCheckpoint("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/agents/ghost/history"))
                .andExpect(status().isNotFound());
    }
}
