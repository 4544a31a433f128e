package com.github.salilvnair.flowsync.transport.ws;

import com.github.salilvnair.flowsync.sync.RemoteChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

@Slf4j
@RequiredArgsConstructor
class WebSocketRemoteChannel implements RemoteChannel {

    private final WebSocketSession session;

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Failed to close websocket socketId={} msg={}", session.getId(), e.getMessage());
        }
    }
}
