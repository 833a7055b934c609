package com.aether.core.persistence;

import com.aether.core.archive.MissionArchive;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service that provides higher-level query operations over the history store and the
 * archive. Backs the history endpoints and the CLI history and timeline commands.
 */
@Service
public class HistoryQueryService {

    private final HistoryStore store;
    private final MissionArchive archive;

    public HistoryQueryService(HistoryStore store, MissionArchive archive) {
        this.store = store;
        this.archive = archive;
    }

    /**
     * Returns all agent ids that have stored history.
     */
    public List<String> listAgentIds() {
        return store.listAgentIds();
    }

    public Optional<EntityCheckpoint> latestCheckpoint(String agentId) {
        return store.loadLatestCheckpoint(agentId);
    }

    /**
     * Events recorded after the latest checkpoint, i.e. what a restart would replay.
     */
    public List<LoggedEvent> pendingEvents(String agentId) {
        long after = store.loadLatestCheckpoint(agentId).map(EntityCheckpoint::sequence).orElse(0L);
        return store.readEventsAfter(agentId, after);
    }

    /**
     * Retired segments still held by the archive followed by the live log, oldest first.
     * Older history may have been evicted from the archive.
     */
    public List<LoggedEvent> timeline(String agentId) {
        List<LoggedEvent> events = new ArrayList<>();
        long last = 0;
        for (HistorySegment segment : archive.segmentsForAgent(agentId)) {
            for (LoggedEvent event : segment.events()) {
                if (event.sequence() > last) {
                    events.add(event);
                    last = event.sequence();
                }
            }
        }
        for (LoggedEvent event : store.readEventsAfter(agentId, last)) {
            events.add(event);
        }
        return events;
    }

    public long segmentSize(String agentId) {
        return store.segmentSize(agentId);
    }
}
