package com.fintech.marketcap.delivery;

import java.io.IOException;

/**
 * Downstream connection (WebSocket session, SSE stream, test double) fed by a
 * delivery loop. {@link #send} may block; it is only ever called from that
 * connection's own loop.
 */
public interface ClientConnection {

    /** Stable identifier, unique among live connections. */
    String id();

    void send(String payload) throws IOException;

    /** Closes the underlying transport. Called when the connection is torn down. */
    void close();
}
