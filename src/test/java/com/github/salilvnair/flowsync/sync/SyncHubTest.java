package com.github.salilvnair.flowsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.flowsync.model.PendingRequest;
import com.github.salilvnair.flowsync.model.RequestKind;
import com.github.salilvnair.flowsync.model.RequestSpec;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.support.FakeRemoteChannel;
import com.github.salilvnair.flowsync.support.FlowSyncHarness;
import com.github.salilvnair.flowsync.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.flowsync.support.TestConstants.ANSWER_YES;
import static com.github.salilvnair.flowsync.support.TestConstants.PIN;
import static com.github.salilvnair.flowsync.support.TestConstants.PROCEED_QUESTION;
import static com.github.salilvnair.flowsync.support.TestConstants.QUEUED_ANSWER;
import static com.github.salilvnair.flowsync.support.TestConstants.REMOTE_ANSWER_A;
import static com.github.salilvnair.flowsync.support.TestConstants.REMOTE_ANSWER_B;
import static com.github.salilvnair.flowsync.support.TestConstants.SOCKET_A;
import static com.github.salilvnair.flowsync.support.TestConstants.SOCKET_B;
import static com.github.salilvnair.flowsync.support.TestConstants.WRONG_PIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncHubTest {

    private FlowSyncHarness harness;
    private SyncHub hub;
    private FakeRemoteChannel channelA;
    private FakeRemoteChannel channelB;

    @BeforeEach
    void setUp() {
        harness = new FlowSyncHarness();
        hub = harness.hub;
        channelA = new FakeRemoteChannel(SOCKET_A);
        channelB = new FakeRemoteChannel(SOCKET_B);
        hub.connect(channelA);
        hub.connect(channelB);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void authenticationRepliesWithSnapshotToThatClientOnly() {
        harness.broker.register(question());

        assertTrue(hub.authenticate(SOCKET_A, PIN));

        JsonNode reply = channelA.last();
        assertEquals("authenticated", reply.path("event").asText());
        assertTrue(reply.path("data").path("success").asBoolean());
        assertEquals(PROCEED_QUESTION, reply.path("data").path("snapshot").path("pendingRequest").path("prompt").asText());
        assertTrue(channelB.frames().isEmpty());
    }

    @Test
    void wrongPinIsRejectedAndReceivesNoBroadcasts() {
        assertFalse(hub.authenticate(SOCKET_A, WRONG_PIN));
        channelA.reset();

        harness.broker.register(question());

        assertTrue(channelA.frames().isEmpty());
        assertEquals(0, hub.authenticatedClients());
    }

    @Test
    void failedAuthenticationReportsReason() {
        hub.onFrame(SOCKET_A, frame("authenticate", Map.of("pin", WRONG_PIN)));

        JsonNode reply = channelA.last();
        assertFalse(reply.path("data").path("success").asBoolean());
        assertEquals("Invalid PIN", reply.path("data").path("message").asText());
    }

    @Test
    void authenticateFrameAcceptsCodeField() {
        hub.onFrame(SOCKET_A, frame("authenticate", Map.of("code", PIN)));

        JsonNode reply = channelA.last();
        assertEquals("authenticated", reply.path("event").asText());
        assertTrue(reply.path("data").path("success").asBoolean());
        assertEquals(1, hub.authenticatedClients());
    }

    @Test
    void authenticateFrameStillAcceptsPinField() {
        hub.onFrame(SOCKET_A, frame("authenticate", Map.of("pin", PIN)));

        assertEquals(1, hub.authenticatedClients());
    }

    @Test
    void unauthenticatedFramesGetAnError() {
        hub.onFrame(SOCKET_A, frame("getState", Map.of()));

        JsonNode reply = channelA.last();
        assertEquals("error", reply.path("event").asText());
        assertEquals("Not authenticated", reply.path("data").path("message").asText());
    }

    @Test
    void malformedFramesGetAnErrorInsteadOfThrowing() {
        hub.onFrame(SOCKET_A, "{not json");

        assertEquals("error", channelA.last().path("event").asText());
    }

    @Test
    void broadcastsReachOnlyAuthenticatedClients() {
        hub.authenticate(SOCKET_A, PIN);
        channelA.reset();

        harness.broker.register(question());

        List<JsonNode> messages = channelA.frames("message");
        assertEquals(1, messages.size());
        assertEquals("pendingRequest", messages.get(0).path("data").path("type").asText());
        assertTrue(channelB.frames().isEmpty());
    }

    @Test
    void lateJoinerSnapshotMatchesStateOfEarlyClient() {
        hub.authenticate(SOCKET_A, PIN);
        harness.broker.enqueuePrompt(QUEUED_ANSWER, List.of());
        harness.broker.setQueuePaused(true);
        harness.broker.register(question());

        hub.authenticate(SOCKET_B, PIN);

        hub.onFrame(SOCKET_A, frame("getState", Map.of()));
        JsonNode earlySnapshot = channelA.last().path("data").path("snapshot");
        JsonNode lateSnapshot = channelB.last().path("data").path("snapshot");
        assertEquals(earlySnapshot, lateSnapshot);
        assertTrue(lateSnapshot.path("queuePaused").asBoolean());
        assertEquals(1, lateSnapshot.path("queue").size());
    }

    @Test
    void fullStateIsIdempotentAndShowsExplicitNullWhenIdle() {
        SyncSnapshot first = hub.getFullState();
        SyncSnapshot second = hub.getFullState();

        assertEquals(first, second);
        JsonNode json = JsonUtil.toTree(first);
        assertTrue(json.has("pendingRequest"));
        assertTrue(json.get("pendingRequest").isNull());
    }

    @Test
    void remoteSubmitResponseSettlesRequest() throws Exception {
        hub.authenticate(SOCKET_A, PIN);
        CompletableFuture<ResolutionResult> settlement = harness.broker.register(question());
        String id = harness.broker.currentRequest().map(PendingRequest::getId).orElseThrow();

        hub.onFrame(SOCKET_A, frame("message", Map.of("type", "submitResponse", "id", id, "value", ANSWER_YES)));

        ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
        assertEquals(ResolutionSource.REMOTE, result.source());
        assertEquals(ANSWER_YES, result.value());
    }

    @Test
    void twoRemoteClientsAndLocalAnswerRaceToOneResolution() throws Exception {
        hub.authenticate(SOCKET_A, PIN);
        hub.authenticate(SOCKET_B, PIN);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            for (int round = 0; round < 30; round++) {
                CompletableFuture<ResolutionResult> settlement = harness.broker.register(question());
                String id = harness.broker.currentRequest().map(PendingRequest::getId).orElseThrow();
                channelA.reset();
                channelB.reset();
                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> local = pool.submit(() -> {
                    start.await();
                    return harness.broker.submitLocal(id, ANSWER_YES, List.of());
                });
                Future<?> remoteA = pool.submit(() -> {
                    start.await();
                    hub.onFrame(SOCKET_A, frame("message", Map.of("type", "submitResponse", "id", id, "value", REMOTE_ANSWER_A)));
                    return null;
                });
                Future<?> remoteB = pool.submit(() -> {
                    start.await();
                    hub.onFrame(SOCKET_B, frame("message", Map.of("type", "submitResponse", "id", id, "value", REMOTE_ANSWER_B)));
                    return null;
                });
                start.countDown();

                boolean localWon = local.get(1, TimeUnit.SECONDS);
                remoteA.get(1, TimeUnit.SECONDS);
                remoteB.get(1, TimeUnit.SECONDS);
                ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
                if (localWon) {
                    assertEquals(ResolutionSource.LOCAL, result.source());
                    assertEquals(ANSWER_YES, result.value());
                } else {
                    assertEquals(ResolutionSource.REMOTE, result.source());
                    assertTrue(List.of(REMOTE_ANSWER_A, REMOTE_ANSWER_B).contains(result.value()));
                }
                assertEquals(1, resolvedMessages(channelA).size());
                assertEquals(1, resolvedMessages(channelB).size());
                assertEquals(id, resolvedMessages(channelA).get(0).path("data").path("id").asText());
                assertFalse(harness.broker.hasPendingRequest());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(30, harness.history.entries().size());
    }

    @Test
    void remoteQueueMessagesMutateTheQueue() {
        hub.authenticate(SOCKET_A, PIN);

        hub.onFrame(SOCKET_A, frame("message", Map.of("type", "queueAdd", "text", QUEUED_ANSWER)));
        hub.onFrame(SOCKET_A, frame("message", Map.of("type", "setPaused", "paused", true)));

        assertEquals(1, harness.queue.state().items().size());
        assertTrue(harness.queue.isPaused());
        List<JsonNode> updates = channelA.frames("message").stream()
                .filter(message -> "queueUpdated".equals(message.path("data").path("type").asText()))
                .toList();
        assertEquals(2, updates.size());
    }

    @Test
    void unknownMessageTypeGetsAnError() {
        hub.authenticate(SOCKET_A, PIN);

        hub.onFrame(SOCKET_A, frame("message", Map.of("type", "launchRocket")));

        assertEquals("error", channelA.last().path("event").asText());
    }

    @Test
    void failingChannelIsDroppedWithoutAffectingOthers() {
        hub.authenticate(SOCKET_A, PIN);
        hub.authenticate(SOCKET_B, PIN);
        channelA.failSends();
        channelB.reset();

        harness.broker.register(question());

        assertEquals(1, hub.connectedClients());
        assertFalse(channelA.isOpen());
        assertEquals(1, channelB.frames("message").size());
    }

    @Test
    void disconnectOfUnknownSocketIsNotAnError() {
        hub.disconnect("socket-unknown");
        hub.disconnect(SOCKET_A);

        assertEquals(1, hub.connectedClients());
    }

    private static List<JsonNode> resolvedMessages(FakeRemoteChannel channel) {
        return channel.frames("message").stream()
                .filter(message -> "requestResolved".equals(message.path("data").path("type").asText()))
                .toList();
    }

    private static String frame(String event, Map<String, Object> data) {
        return JsonUtil.toJson(Map.of("event", event, "data", data));
    }

    private RequestSpec question() {
        return RequestSpec.builder()
                .kind(RequestKind.QUESTION)
                .prompt(PROCEED_QUESTION)
                .build();
    }
}
