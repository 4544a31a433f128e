package com.github.salilvnair.flowsync.event;

public interface InteractionEventListener {
    void onEvent(SyncEvent event);
}
