package com.aether.dispatch.api;

import com.aether.core.entity.AgentAlreadyEnrolledException;
import com.aether.core.entity.FleetRegistry;
import com.aether.core.entity.SignalTimeoutException;
import com.aether.core.entity.UnknownAgentException;
import com.aether.core.events.ConnectivityChange;
import com.aether.core.events.EventBus;
import com.aether.core.model.AgentSnapshot;
import com.aether.core.model.AssignmentResult;
import com.aether.core.model.MissionPlan;
import com.aether.core.persistence.EntityCheckpoint;
import com.aether.core.persistence.HistoryQueryService;
import com.aether.core.persistence.HistoryStoreException;
import com.aether.core.persistence.LoggedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for agent enrollment, telemetry ingestion and operator signals.
 * <p>
 * Every call goes through the agent's actor, so requests for one agent are applied
 * in arrival order. Synchronous signals answer 504 when the actor does not reply
 * within the configured signal timeout.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final FleetRegistry registry;
    private final EventBus eventBus;
    private final HistoryQueryService historyQuery;
    private final Clock clock;

    public AgentController(FleetRegistry registry, EventBus eventBus,
                           HistoryQueryService historyQuery, Clock clock) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.historyQuery = historyQuery;
        this.clock = clock;
    }

    /**
     * POST /api/v1/agents — Enroll a new agent. It starts OFFLINE until it connects.
     */
    @PostMapping
    public ResponseEntity<?> enroll(@RequestBody EnrollRequest request) {
        if (request.agentId() == null || request.agentId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "agent_id is required"));
        }
        return handle(request.agentId(), () ->
                ResponseEntity.status(201).body(registry.enroll(request.agentId(), request.toAttributes())));
    }

    /**
     * GET /api/v1/agents — All enrolled agents, by id.
     */
    @GetMapping
    public ResponseEntity<List<AgentSnapshot>> listAgents() {
        return ResponseEntity.ok(registry.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getAgent(@PathVariable String id) {
        return handle(id, () -> ResponseEntity.ok(registry.require(id)));
    }

    /**
     * DELETE /api/v1/agents/{id} — Decommission: aborts any mission and deletes history.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> decommission(@PathVariable String id) {
        return handle(id, () -> {
            registry.decommission(id);
            return ResponseEntity.noContent().build();
        });
    }

    /**
     * POST /api/v1/agents/{id}/telemetry — Queue a telemetry sample. Returns 202 once the
     * sample is in the agent's mailbox; {@code ?sync=true} waits and returns the new state.
     */
    @PostMapping("/{id}/telemetry")
    public ResponseEntity<?> telemetry(@PathVariable String id,
                                       @RequestBody TelemetryRequest request,
                                       @RequestParam(name = "sync", defaultValue = "false") boolean sync) {
        var event = request.toEvent(id, clock.millis());
        if (sync) {
            return handle(id, () -> ResponseEntity.ok(registry.ingest(event)));
        }
        if (!eventBus.publish(event)) {
            return notFound(id);
        }
        return ResponseEntity.accepted().body(Map.of("agent_id", id, "accepted", true));
    }

    @PostMapping("/{id}/connectivity")
    public ResponseEntity<?> connectivity(@PathVariable String id, @RequestBody ConnectivityRequest request) {
        long ts = request.timestamp() != null ? request.timestamp() : clock.millis();
        return handle(id, () -> ResponseEntity.ok(registry.ingest(new ConnectivityChange(id, ts, request.connected()))));
    }

    /**
     * POST /api/v1/agents/{id}/missions — Assign a plan. 202 when accepted,
     * 409 busy, 503 unreachable, 422 constraint violation.
     */
    @PostMapping("/{id}/missions")
    public ResponseEntity<?> assign(@PathVariable String id, @RequestBody MissionPlan plan) {
        if (plan == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Mission plan is required"));
        }
        return handle(id, () -> assignmentResponse(registry.assign(id, plan)));
    }

    /**
     * POST /api/v1/agents/{id}/drafts — Store a proposed plan awaiting approval.
     */
    @PostMapping("/{id}/drafts")
    public ResponseEntity<?> proposePlan(@PathVariable String id, @RequestBody DraftRequest request) {
        if (request.plan() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "plan is required"));
        }
        return handle(id, () -> {
            String draftId = registry.proposePlan(id, request.draftId(), request.plan());
            return ResponseEntity.status(201).body(Map.of("agent_id", id, "draft_id", draftId));
        });
    }

    @PostMapping("/{id}/drafts/{draftId}/approve")
    public ResponseEntity<?> approvePlan(@PathVariable String id, @PathVariable String draftId) {
        return handle(id, () -> assignmentResponse(registry.approvePlan(id, draftId)));
    }

    @PostMapping("/{id}/drafts/{draftId}/reject")
    public ResponseEntity<?> rejectPlan(@PathVariable String id, @PathVariable String draftId,
                                        @RequestBody(required = false) RejectRequest request) {
        String feedback = request != null ? request.feedback() : null;
        return handle(id, () -> {
            if (!registry.rejectPlan(id, draftId, feedback)) {
                return ResponseEntity.status(404).body(Map.of("error", "Draft not found: " + draftId));
            }
            return ResponseEntity.ok(Map.of("agent_id", id, "draft_id", draftId, "status", "REJECTED"));
        });
    }

    @PostMapping("/{id}/emergency-stop")
    public ResponseEntity<?> emergencyStop(@PathVariable String id) {
        log.warn("Emergency stop requested for agent {}", id);
        return handle(id, () -> ResponseEntity.ok(registry.emergencyStop(id)));
    }

    @PostMapping("/{id}/clear-error")
    public ResponseEntity<?> clearError(@PathVariable String id) {
        return handle(id, () -> ResponseEntity.ok(registry.clearError(id)));
    }

    /**
     * GET /api/v1/agents/{id}/history — Latest checkpoint position plus the events a
     * restart would replay on top of it.
     */
    @GetMapping("/{id}/history")
    public ResponseEntity<?> history(@PathVariable String id) {
        return handle(id, () -> {
            var checkpoint = historyQuery.latestCheckpoint(id);
            if (checkpoint.isEmpty()) {
                return notFound(id);
            }
            EntityCheckpoint cp = checkpoint.get();
            List<LoggedEvent> pending = historyQuery.pendingEvents(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("agent_id", id);
            body.put("checkpoint_sequence", cp.sequence());
            body.put("checkpoint_taken_at", cp.takenAt().toString());
            body.put("segment_size", historyQuery.segmentSize(id));
            body.put("pending_events", pending.stream().map(AgentController::describe).toList());
            return ResponseEntity.ok(body);
        });
    }

    private static Map<String, Object> describe(LoggedEvent logged) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("sequence", logged.sequence());
        entry.put("type", logged.event().eventName());
        entry.put("timestamp", logged.event().timestamp());
        entry.put("recorded_at", logged.recordedAt().toString());
        return entry;
    }

    private static ResponseEntity<?> assignmentResponse(AssignmentResult result) {
        int status = switch (result.outcome()) {
            case ACCEPTED -> 202;
            case BUSY -> 409;
            case UNREACHABLE -> 503;
            case CONSTRAINT_VIOLATION -> 422;
        };
        return ResponseEntity.status(status).body(result);
    }

    private static ResponseEntity<?> notFound(String agentId) {
        return ResponseEntity.status(404).body(Map.of("error", "Agent not found: " + agentId));
    }

    private ResponseEntity<?> handle(String agentId, Supplier<ResponseEntity<?>> call) {
        try {
            return call.get();
        } catch (UnknownAgentException e) {
            return notFound(agentId);
        } catch (AgentAlreadyEnrolledException e) {
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        } catch (SignalTimeoutException e) {
            log.warn("Signal to agent {} timed out: {}", agentId, e.getMessage());
            return ResponseEntity.status(504).body(Map.of("error", e.getMessage()));
        } catch (HistoryStoreException e) {
            log.error("History store failure for agent {}", agentId, e);
            return ResponseEntity.status(500).body(Map.of("error", "History store failure: " + e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
