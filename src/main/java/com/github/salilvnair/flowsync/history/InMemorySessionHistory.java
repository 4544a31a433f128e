package com.github.salilvnair.flowsync.history;

import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.model.HistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

@Slf4j
@Component
public class InMemorySessionHistory implements SessionHistory {

    private final int maxEntries;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public InMemorySessionHistory(FlowSyncConfig config) {
        this.maxEntries = Math.max(1, config.getHistory().getMaxEntries());
    }

    @Override
    public synchronized void record(HistoryEntry entry) {
        if (entry == null) {
            return;
        }
        entries.removeIf(existing -> existing.id().equals(entry.id()));
        entries.addFirst(entry);
        while (entries.size() > maxEntries) {
            HistoryEntry dropped = entries.removeLast();
            log.debug("Session history trimmed id={}", dropped.id());
        }
    }

    @Override
    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }
}
