package com.aether.dispatch.api;

import com.aether.core.entity.SignalTimeoutException;
import com.aether.core.fleet.DispatchOutcome;
import com.aether.core.fleet.FleetDispatcher;
import com.aether.core.fleet.MissionDispatchService;
import com.aether.core.model.DispatchMatch;
import com.aether.core.model.DispatchQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for capability and proximity dispatch queries.
 */
@RestController
@RequestMapping("/api/v1/dispatch")
public class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final FleetDispatcher dispatcher;
    private final MissionDispatchService dispatchService;

    public DispatchController(FleetDispatcher dispatcher, MissionDispatchService dispatchService) {
        this.dispatcher = dispatcher;
        this.dispatchService = dispatchService;
    }

    /**
     * POST /api/v1/dispatch/find — Best matching agent, or 404 when none qualifies.
     */
    @PostMapping("/find")
    public ResponseEntity<?> find(@RequestBody DispatchQuery query) {
        return dispatcher.find(query)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "No agent matches the query")));
    }

    /**
     * POST /api/v1/dispatch/rank — Every matching agent, best first.
     */
    @PostMapping("/rank")
    public ResponseEntity<List<DispatchMatch>> rank(@RequestBody DispatchQuery query) {
        return ResponseEntity.ok(dispatcher.rank(query));
    }

    /**
     * POST /api/v1/dispatch — Find the best agent and assign it the plan.
     */
    @PostMapping
    public ResponseEntity<?> dispatch(@RequestBody DispatchRequest request) {
        if (request.query() == null || request.plan() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "query and plan are required"));
        }
        DispatchOutcome outcome;
        try {
            outcome = dispatchService.dispatch(request.query(), request.plan());
        } catch (SignalTimeoutException e) {
            log.warn("Dispatch timed out: {}", e.getMessage());
            return ResponseEntity.status(504).body(Map.of("error", e.getMessage()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("attempts", outcome.attempts());
        if (outcome.result() == null) {
            body.put("error", "No agent matches the query");
            return ResponseEntity.status(404).body(body);
        }
        body.put("agent_id", outcome.agentId());
        body.put("result", outcome.result());
        int status = switch (outcome.result().outcome()) {
            case ACCEPTED -> 202;
            case BUSY -> 409;
            case UNREACHABLE -> 503;
            case CONSTRAINT_VIOLATION -> 422;
        };
        return ResponseEntity.status(status).body(body);
    }
}
