package com.github.salilvnair.flowsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flowsync")
@Getter
@Setter
public class FlowSyncConfig {

    private Queue queue = new Queue();
    private Broker broker = new Broker();
    private History history = new History();
    private Remote remote = new Remote();

    @Getter
    @Setter
    public static class Queue {
        private boolean enabled = true;
        private boolean paused = false;
        private int maxPromptLength = 100_000;
    }

    @Getter
    @Setter
    public static class Broker {
        private long processingTimeoutMs = 30_000L;
        private String writerThreadName = "flowsync-writer";
    }

    @Getter
    @Setter
    public static class History {
        private int maxEntries = 50;
    }

    @Getter
    @Setter
    public static class Remote {
        private boolean enabled = true;
        /** Shared numeric code; a random 4-digit code is generated when blank. */
        private String pin = "";
    }
}
