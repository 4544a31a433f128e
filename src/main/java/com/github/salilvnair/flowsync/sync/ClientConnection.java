package com.github.salilvnair.flowsync.sync;

import lombok.Getter;

@Getter
public class ClientConnection {

    private final RemoteChannel channel;
    private final long connectedAt;
    private volatile boolean authenticated;

    public ClientConnection(RemoteChannel channel) {
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
    }

    public String getSocketId() {
        return channel.id();
    }

    void markAuthenticated() {
        this.authenticated = true;
    }
}
