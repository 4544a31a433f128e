package com.github.salilvnair.flowsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flowsync.transport")
@Getter
@Setter
public class FlowSyncTransportConfig {

    private WebSocket websocket = new WebSocket();

    @Getter
    @Setter
    public static class WebSocket {
        private boolean enabled = true;
        private String endpoint = "/ws-flowsync";
        private String allowedOriginPattern = "*";
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeLimit = 512 * 1024;
    }
}
