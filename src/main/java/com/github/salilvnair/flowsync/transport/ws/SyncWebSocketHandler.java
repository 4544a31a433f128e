package com.github.salilvnair.flowsync.transport.ws;

import com.github.salilvnair.flowsync.config.FlowSyncTransportConfig;
import com.github.salilvnair.flowsync.sync.SyncHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Slf4j
@Component
@RequiredArgsConstructor
public class SyncWebSocketHandler extends TextWebSocketHandler {

    private final SyncHub syncHub;
    private final FlowSyncTransportConfig transportConfig;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        FlowSyncTransportConfig.WebSocket settings = transportConfig.getWebsocket();
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session,
                settings.getSendTimeLimitMs(),
                settings.getSendBufferSizeLimit());
        syncHub.connect(new WebSocketRemoteChannel(concurrentSession));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        syncHub.onFrame(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("WebSocket transport error socketId={} msg={}", session.getId(), exception.getMessage());
        syncHub.disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        syncHub.disconnect(session.getId());
    }
}
