package com.github.salilvnair.flowsync.transport.ws;

import com.github.salilvnair.flowsync.config.FlowSyncTransportConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@ConditionalOnClass(WebSocketConfigurer.class)
@ConditionalOnProperty(prefix = "flowsync.transport.websocket", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlowSyncWebSocketConfig implements WebSocketConfigurer {

    private final FlowSyncTransportConfig transportConfig;
    private final SyncWebSocketHandler syncWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(syncWebSocketHandler, transportConfig.getWebsocket().getEndpoint())
                .setAllowedOriginPatterns(transportConfig.getWebsocket().getAllowedOriginPattern());
    }
}
