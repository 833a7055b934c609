package com.aether.dispatch.api;

import com.aether.core.mission.MissionStatusService;
import com.aether.core.model.MissionExecution;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for mission status. Live missions come from their owning actor's
 * last committed state, finished ones from the archive.
 */
@RestController
@RequestMapping("/api/v1/missions")
public class MissionController {

    private final MissionStatusService missionStatus;

    public MissionController(MissionStatusService missionStatus) {
        this.missionStatus = missionStatus;
    }

    /**
     * GET /api/v1/missions/{id} — Mission phase, progress and abort reason.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getMission(@PathVariable String id) {
        return missionStatus.find(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Mission not found: " + id)));
    }

    /**
     * GET /api/v1/missions?agent={agentId} — All missions an agent has held.
     */
    @GetMapping(params = "agent")
    public ResponseEntity<List<MissionExecution>> listForAgent(@RequestParam("agent") String agentId) {
        return ResponseEntity.ok(missionStatus.listForAgent(agentId));
    }
}
