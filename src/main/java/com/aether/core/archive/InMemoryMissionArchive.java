package com.aether.core.archive;

import com.aether.core.model.MissionExecution;
import com.aether.core.persistence.HistorySegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process {@link MissionArchive}. Oldest missions are evicted first; each
 * agent keeps only its most recent retired segments.
 */
@Component
public class InMemoryMissionArchive implements MissionArchive {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMissionArchive.class);

    static final int MAX_MISSIONS = 10_000;
    static final int MAX_SEGMENTS_PER_AGENT = 16;

    private final LinkedHashMap<String, MissionExecution> missions = new LinkedHashMap<>();
    private final Map<String, Deque<HistorySegment>> segments = new LinkedHashMap<>();

    @Override
    public synchronized void archive(MissionExecution mission) {
        missions.remove(mission.missionId());
        missions.put(mission.missionId(), mission);
        if (missions.size() > MAX_MISSIONS) {
            Iterator<String> oldest = missions.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        log.info("Archived mission {} ({}{})", mission.missionId(), mission.phase(),
                mission.abortReason() != null ? ", " + mission.abortReason() : "");
    }

    @Override
    public synchronized void archiveSegment(HistorySegment segment) {
        if (segment.isEmpty()) {
            return;
        }
        Deque<HistorySegment> agentSegments = segments.computeIfAbsent(segment.agentId(), id -> new ArrayDeque<>());
        agentSegments.addLast(segment);
        while (agentSegments.size() > MAX_SEGMENTS_PER_AGENT) {
            agentSegments.removeFirst();
        }
        log.debug("Archived history segment {}..{} for agent {}",
                segment.fromSequence(), segment.toSequence(), segment.agentId());
    }

    @Override
    public synchronized Optional<MissionExecution> find(String missionId) {
        return Optional.ofNullable(missions.get(missionId));
    }

    @Override
    public synchronized List<MissionExecution> listForAgent(String agentId) {
        return missions.values().stream()
                .filter(m -> agentId.equals(m.agentId()))
                .toList();
    }

    @Override
    public synchronized List<HistorySegment> segmentsForAgent(String agentId) {
        Deque<HistorySegment> agentSegments = segments.get(agentId);
        return agentSegments == null ? List.of() : new ArrayList<>(agentSegments);
    }
}
