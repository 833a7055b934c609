package com.aether.core.mission;

import com.aether.core.model.CommandType;
import com.aether.core.model.PendingCommand;

/**
 * Side effects a mission asks of its owning entity actor. The actor decides whether
 * they really happen (they are suppressed while history is being replayed).
 */
public interface MissionContext {

    /**
     * Send a tracked mission command and arm its acknowledgement deadline.
     */
    void sendCommand(String missionId, PendingCommand command, long timestamp);

    /**
     * Send a recovery directive (RTL, LAND, HOLD) issued as a mission aborts.
     * The mission is already terminal, so the actor tracks it on its own.
     */
    void sendRecovery(String missionId, PendingCommand command, long timestamp);

    void commandRetried(CommandType type);
}
