package com.github.salilvnair.flowsync.queue;

import com.github.salilvnair.flowsync.model.QueueItem;

import java.util.List;

public record QueueState(List<QueueItem> items, boolean enabled, boolean paused) {

    public QueueState {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
