package com.github.salilvnair.flowsync.queue;

import com.github.salilvnair.flowsync.broker.InteractionExecutor;
import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.event.InteractionEventDispatcher;
import com.github.salilvnair.flowsync.event.SyncEvent;
import com.github.salilvnair.flowsync.model.AttachmentRef;
import com.github.salilvnair.flowsync.model.QueueItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered list of answers the human prepared in advance. All state is confined to the
 * interaction executor; every visible change is published as {@code queueUpdated}.
 * Whether the head may be consumed is decided by the broker, not here.
 */
@Slf4j
@Component
public class PromptQueue {

    private final InteractionExecutor executor;
    private final InteractionEventDispatcher dispatcher;
    private final int maxPromptLength;

    private final List<QueueItem> items = new ArrayList<>();
    private boolean enabled;
    private boolean paused;

    public PromptQueue(InteractionExecutor executor, InteractionEventDispatcher dispatcher, FlowSyncConfig config) {
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.maxPromptLength = config.getQueue().getMaxPromptLength();
        this.enabled = config.getQueue().isEnabled();
        this.paused = config.getQueue().isPaused();
    }

    /**
     * @return the new item id, or empty when the text is blank or too long
     */
    public Optional<String> enqueue(String text, List<AttachmentRef> attachments) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.length() > maxPromptLength) {
            log.warn("Rejected queue prompt length={} max={}", trimmed.length(), maxPromptLength);
            return Optional.empty();
        }
        return executor.call(() -> {
            QueueItem item = new QueueItem(newId(), trimmed, attachments);
            items.add(item);
            log.debug("Queued prompt id={} size={}", item.id(), items.size());
            publish();
            return Optional.of(item.id());
        });
    }

    /**
     * Removes and returns the head. Callers check {@link #isEnabled()} and {@link #isPaused()} first.
     */
    public Optional<QueueItem> dequeue() {
        return executor.call(() -> {
            if (items.isEmpty()) {
                return Optional.<QueueItem>empty();
            }
            QueueItem head = items.remove(0);
            publish();
            return Optional.of(head);
        });
    }

    public boolean remove(String id) {
        return executor.call(() -> {
            boolean removed = items.removeIf(item -> item.id().equals(id));
            if (removed) {
                publish();
            }
            return removed;
        });
    }

    public boolean edit(String id, String newText) {
        if (newText == null || newText.isBlank() || newText.trim().length() > maxPromptLength) {
            return false;
        }
        String trimmed = newText.trim();
        return executor.call(() -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).id().equals(id)) {
                    items.set(i, items.get(i).withText(trimmed));
                    publish();
                    return true;
                }
            }
            return false;
        });
    }

    public boolean reorder(int fromIndex, int toIndex) {
        return executor.call(() -> {
            if (fromIndex < 0 || toIndex < 0 || fromIndex >= items.size() || toIndex >= items.size()) {
                return false;
            }
            if (fromIndex == toIndex) {
                return true;
            }
            QueueItem moved = items.remove(fromIndex);
            items.add(toIndex, moved);
            publish();
            return true;
        });
    }

    public void clear() {
        executor.run(() -> {
            items.clear();
            publish();
        });
    }

    public void setEnabled(boolean value) {
        executor.run(() -> {
            if (enabled != value) {
                enabled = value;
                log.info("Prompt queue enabled={}", value);
                publish();
            }
        });
    }

    public void setPaused(boolean value) {
        executor.run(() -> {
            if (paused != value) {
                paused = value;
                log.info("Prompt queue paused={}", value);
                publish();
            }
        });
    }

    public boolean isEnabled() {
        return executor.call(() -> enabled);
    }

    public boolean isPaused() {
        return executor.call(() -> paused);
    }

    public boolean isEmpty() {
        return executor.call(items::isEmpty);
    }

    public QueueState state() {
        return executor.call(() -> new QueueState(items, enabled, paused));
    }

    private void publish() {
        dispatcher.dispatch(SyncEvent.queueUpdated(new QueueState(items, enabled, paused)));
    }

    private String newId() {
        return "q_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
