package com.aether.core.mission;

import com.aether.core.archive.MissionArchive;
import com.aether.core.model.MissionExecution;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read side for mission status. Live missions are published here by their owning
 * actor after every processed event; finished missions are answered from the archive.
 */
@Service
public class MissionStatusService {

    private final ConcurrentHashMap<String, MissionExecution> live = new ConcurrentHashMap<>();
    private final MissionArchive archive;

    public MissionStatusService(MissionArchive archive) {
        this.archive = archive;
    }

    public void update(MissionExecution mission) {
        live.put(mission.missionId(), mission);
    }

    public void remove(String missionId) {
        live.remove(missionId);
    }

    public Optional<MissionExecution> find(String missionId) {
        MissionExecution current = live.get(missionId);
        return current != null ? Optional.of(current) : archive.find(missionId);
    }

    /**
     * Archived and live missions of one agent, by start time.
     */
    public List<MissionExecution> listForAgent(String agentId) {
        List<MissionExecution> missions = new ArrayList<>(archive.listForAgent(agentId));
        live.values().stream()
                .filter(m -> agentId.equals(m.agentId()))
                .forEach(missions::add);
        missions.sort(Comparator.comparing(MissionExecution::startTime,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return missions;
    }
}
