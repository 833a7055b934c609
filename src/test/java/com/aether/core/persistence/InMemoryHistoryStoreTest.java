package com.aether.core.persistence;

import com.aether.core.events.ConnectivityChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryHistoryStoreTest {

    private InMemoryHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryHistoryStore(Clock.systemUTC());
        for (long seq = 1; seq <= 5; seq++) {
            store.appendEvent("D1", seq, new ConnectivityChange("D1", seq * 100, true));
        }
    }

    @Test
    @DisplayName("readEventsAfter excludes the given sequence")
    void readAfter() {
        assertEquals(List.of(4L, 5L),
                store.readEventsAfter("D1", 3).stream().map(LoggedEvent::sequence).toList());
        assertTrue(store.readEventsAfter("unknown", 0).isEmpty());
    }

    @Test
    @DisplayName("truncation keeps events above the checkpoint")
    void truncate() {
        HistorySegment segment = store.readSegment("D1", 3);

        assertEquals(3, store.truncateThrough("D1", 3));
        assertEquals(3, segment.events().size());
        assertEquals(2, store.segmentSize("D1"));
    }

    @Test
    @DisplayName("agents are listed only while they have events or a checkpoint")
    void listing() {
        store.truncateThrough("D1", 5);
        assertTrue(store.listAgentIds().isEmpty());

        store.appendEvent("D1", 6, new ConnectivityChange("D1", 600, false));
        assertEquals(List.of("D1"), store.listAgentIds());

        store.deleteAgent("D1");
        assertTrue(store.listAgentIds().isEmpty());
    }
}
