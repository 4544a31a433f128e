package com.github.salilvnair.flowsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.flowsync.broker.InteractionExecutor;
import com.github.salilvnair.flowsync.broker.ProcessingIndicator;
import com.github.salilvnair.flowsync.broker.RequestBroker;
import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.event.InteractionEventListener;
import com.github.salilvnair.flowsync.event.SyncEvent;
import com.github.salilvnair.flowsync.exception.FlowSyncErrorCode;
import com.github.salilvnair.flowsync.exception.FlowSyncException;
import com.github.salilvnair.flowsync.history.SessionHistory;
import com.github.salilvnair.flowsync.model.AttachmentRef;
import com.github.salilvnair.flowsync.model.PlanRevision;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.queue.PromptQueue;
import com.github.salilvnair.flowsync.queue.QueueState;
import com.github.salilvnair.flowsync.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges remote clients to the broker. Clients authenticate with a shared PIN, then
 * receive a full snapshot followed by every state change in order. Snapshots and
 * broadcasts are both produced on the interaction executor, so a client never sees a
 * snapshot older than an event it already received.
 */
@Slf4j
@Component
public class SyncHub implements InteractionEventListener {

    private final RequestBroker requestBroker;
    private final PromptQueue promptQueue;
    private final SessionHistory sessionHistory;
    private final ProcessingIndicator processingIndicator;
    private final InteractionExecutor executor;
    private final boolean remoteEnabled;
    private final String pin;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public SyncHub(RequestBroker requestBroker,
                   PromptQueue promptQueue,
                   SessionHistory sessionHistory,
                   ProcessingIndicator processingIndicator,
                   InteractionExecutor executor,
                   FlowSyncConfig config) {
        this.requestBroker = requestBroker;
        this.promptQueue = promptQueue;
        this.sessionHistory = sessionHistory;
        this.processingIndicator = processingIndicator;
        this.executor = executor;
        this.remoteEnabled = config.getRemote().isEnabled();
        String configuredPin = config.getRemote().getPin();
        this.pin = configuredPin == null || configuredPin.isBlank() ? generatePin() : configuredPin.trim();
        if (remoteEnabled) {
            log.info("FlowSync remote access PIN: {}", pin);
        }
    }

    public String getPin() {
        return pin;
    }

    public void connect(RemoteChannel channel) {
        connections.put(channel.id(), new ClientConnection(channel));
        log.debug("Remote client connected socketId={} clients={}", channel.id(), connections.size());
    }

    public void disconnect(String socketId) {
        if (connections.remove(socketId) != null) {
            log.debug("Remote client disconnected socketId={} clients={}", socketId, connections.size());
        }
    }

    public int connectedClients() {
        return connections.size();
    }

    public int authenticatedClients() {
        return (int) connections.values().stream().filter(ClientConnection::isAuthenticated).count();
    }

    /**
     * Entry point for one raw inbound frame.
     */
    public void onFrame(String socketId, String raw) {
        ClientConnection connection = connections.get(socketId);
        if (connection == null) {
            log.debug("Dropping frame from unknown socketId={}", socketId);
            return;
        }
        JsonNode frame = JsonUtil.parseOrNull(raw);
        String event = JsonUtil.text(frame, "event");
        if (event == null) {
            sendError(connection, FlowSyncErrorCode.MALFORMED_FRAME.defaultMessage());
            return;
        }
        JsonNode data = frame.get("data");
        try {
            switch (event) {
                case SyncFrame.AUTHENTICATE -> authenticate(socketId, authCode(data));
                case SyncFrame.GET_STATE -> {
                    if (requireAuthenticated(connection)) {
                        executor.run(() -> send(connection, SyncFrame.STATE, Map.of("snapshot", getFullState())));
                    }
                }
                case SyncFrame.MESSAGE -> {
                    if (requireAuthenticated(connection)) {
                        handleMessage(connection, data);
                    }
                }
                default -> sendError(connection, "Unknown event: " + event);
            }
        } catch (FlowSyncException e) {
            log.warn("Remote frame failed socketId={} event={} code={} msg={}", socketId, event, e.getErrorCode(), e.getMessage());
            sendError(connection, e.getMessage());
        }
    }

    /**
     * Verifies the PIN; on success the client receives the full snapshot in the same reply.
     */
    public boolean authenticate(String socketId, String code) {
        ClientConnection connection = connections.get(socketId);
        if (connection == null) {
            return false;
        }
        if (!remoteEnabled || code == null || !pinMatches(code.trim())) {
            log.info("Remote authentication failed socketId={}", socketId);
            send(connection, SyncFrame.AUTHENTICATED, Map.of(
                    "success", false,
                    "message", remoteEnabled ? "Invalid PIN" : "Remote access is disabled"));
            return false;
        }
        executor.run(() -> {
            connection.markAuthenticated();
            send(connection, SyncFrame.AUTHENTICATED, Map.of("success", true, "snapshot", getFullState()));
        });
        log.info("Remote client authenticated socketId={}", socketId);
        return true;
    }

    public SyncSnapshot getFullState() {
        return executor.call(() -> {
            QueueState queue = promptQueue.state();
            return new SyncSnapshot(
                    requestBroker.currentRequest().orElse(null),
                    queue.items(),
                    queue.enabled(),
                    queue.paused(),
                    processingIndicator.isProcessing(),
                    sessionHistory.entries());
        });
    }

    @Override
    public void onEvent(SyncEvent event) {
        broadcast(event);
    }

    public void broadcast(SyncEvent event) {
        Map<String, Object> message = event.toMessage();
        for (ClientConnection connection : connections.values()) {
            if (connection.isAuthenticated()) {
                send(connection, SyncFrame.MESSAGE, message);
            }
        }
    }

    private void handleMessage(ClientConnection connection, JsonNode data) {
        String type = JsonUtil.text(data, "type");
        Optional<ClientMessageType> messageType = ClientMessageType.fromWire(type);
        if (messageType.isEmpty()) {
            sendError(connection, FlowSyncErrorCode.UNKNOWN_MESSAGE_TYPE.defaultMessage() + ": " + type);
            return;
        }
        switch (messageType.get()) {
            case SUBMIT_RESPONSE -> submitResponse(connection, data);
            case CANCEL_REQUEST -> requestBroker.cancel(JsonUtil.text(data, "id"), "cancelled remotely");
            case QUEUE_ADD -> requestBroker.enqueuePrompt(
                    JsonUtil.text(data, "text"),
                    JsonUtil.treeToListOrEmpty(data.get("attachments"), AttachmentRef.class));
            case QUEUE_EDIT -> promptQueue.edit(JsonUtil.text(data, "id"), JsonUtil.text(data, "text"));
            case QUEUE_REMOVE -> promptQueue.remove(JsonUtil.text(data, "id"));
            case QUEUE_REORDER -> promptQueue.reorder(data.path("fromIndex").asInt(-1), data.path("toIndex").asInt(-1));
            case QUEUE_CLEAR -> promptQueue.clear();
            case SET_PAUSED -> requestBroker.setQueuePaused(data.path("paused").asBoolean(false));
            case SET_ENABLED -> requestBroker.setQueueEnabled(data.path("enabled").asBoolean(true));
        }
    }

    private void submitResponse(ClientConnection connection, JsonNode data) {
        String id = JsonUtil.text(data, "id");
        if (id == null) {
            sendError(connection, "submitResponse requires an id");
            return;
        }
        String value = JsonUtil.text(data, "value");
        JsonNode answers = data.get("answers");
        if (answers != null && answers.isArray()) {
            ObjectNode wrapped = JsonUtil.object();
            wrapped.set("answers", answers);
            value = JsonUtil.toJson(wrapped);
        }
        List<AttachmentRef> attachments = JsonUtil.treeToListOrEmpty(data.get("attachments"), AttachmentRef.class);
        List<PlanRevision> revisions = JsonUtil.treeToListOrEmpty(data.get("revisions"), PlanRevision.class);
        boolean accepted = requestBroker.submit(id, new ResolutionResult(ResolutionSource.REMOTE, value, attachments, revisions));
        if (!accepted) {
            log.debug("Remote submission lost the race socketId={} id={}", connection.getSocketId(), id);
        }
    }

    private boolean requireAuthenticated(ClientConnection connection) {
        if (connection.isAuthenticated()) {
            return true;
        }
        sendError(connection, FlowSyncErrorCode.NOT_AUTHENTICATED.defaultMessage());
        return false;
    }

    private void sendError(ClientConnection connection, String message) {
        send(connection, SyncFrame.ERROR, Map.of("message", message));
    }

    private void send(ClientConnection connection, String event, Object data) {
        RemoteChannel channel = connection.getChannel();
        if (!channel.isOpen()) {
            disconnect(channel.id());
            return;
        }
        try {
            channel.send(JsonUtil.toJson(new SyncFrame(event, JsonUtil.toTree(data))));
        } catch (IOException | RuntimeException e) {
            log.debug("Dropping remote client after failed send socketId={} msg={}", channel.id(), e.getMessage());
            disconnect(channel.id());
            channel.close();
        }
    }

    // "pin" is accepted from older clients
    private static String authCode(JsonNode data) {
        String code = JsonUtil.text(data, "code");
        return code != null ? code : JsonUtil.text(data, "pin");
    }

    private boolean pinMatches(String candidate) {
        return MessageDigest.isEqual(
                pin.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }

    private static String generatePin() {
        return String.format("%04d", new SecureRandom().nextInt(10_000));
    }
}
