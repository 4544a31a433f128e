package com.github.salilvnair.flowsync.history;

import com.github.salilvnair.flowsync.model.HistoryEntry;

import java.util.List;

/**
 * Where resolved requests are recorded. Hosts may supply their own bean to persist entries.
 */
public interface SessionHistory {

    void record(HistoryEntry entry);

    /**
     * Newest first.
     */
    List<HistoryEntry> entries();

    void clear();
}
