package com.github.salilvnair.flowsync.sync;

import java.io.IOException;

/**
 * One remote client's outbound pipe, independent of the transport carrying it.
 */
public interface RemoteChannel {

    String id();

    void send(String frame) throws IOException;

    boolean isOpen();

    void close();
}
