package com.aether.core.archive;

import com.aether.core.model.MissionExecution;
import com.aether.core.persistence.HistorySegment;

import java.util.List;
import java.util.Optional;

/**
 * Long-term home of finished missions and of history segments retired by compaction.
 * Archiving the same mission twice keeps the latest record.
 */
public interface MissionArchive {

    void archive(MissionExecution mission);

    void archiveSegment(HistorySegment segment);

    Optional<MissionExecution> find(String missionId);

    /** Archived missions of one agent, oldest first. */
    List<MissionExecution> listForAgent(String agentId);

    /** Retired history segments of one agent, oldest first. */
    List<HistorySegment> segmentsForAgent(String agentId);
}
