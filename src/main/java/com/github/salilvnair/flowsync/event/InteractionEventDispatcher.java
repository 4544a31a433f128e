package com.github.salilvnair.flowsync.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Fans state changes out to every surface. Listeners are resolved lazily because the
 * sync hub is both a listener and a consumer of the broker that dispatches here.
 */
@Slf4j
@Component
public class InteractionEventDispatcher {

    private final Supplier<Stream<InteractionEventListener>> listeners;

    @Autowired
    public InteractionEventDispatcher(ObjectProvider<InteractionEventListener> listenerProvider) {
        this.listeners = listenerProvider::orderedStream;
    }

    public InteractionEventDispatcher(List<InteractionEventListener> listeners) {
        List<InteractionEventListener> fixed = listeners == null ? List.of() : List.copyOf(listeners);
        this.listeners = fixed::stream;
    }

    public void dispatch(SyncEvent event) {
        if (event == null) {
            return;
        }
        listeners.get().forEach(listener -> {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Interaction event dispatch failed listener={} type={} msg={}",
                        listener.getClass().getSimpleName(),
                        event.type().wireName(),
                        e.getMessage());
            }
        });
    }
}
