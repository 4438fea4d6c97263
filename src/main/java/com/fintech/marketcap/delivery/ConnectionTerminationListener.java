package com.fintech.marketcap.delivery;

/**
 * Notified when a delivery loop gives up on a connection because its health
 * fell below the floor. The listener is expected to tear the connection down.
 */
@FunctionalInterface
public interface ConnectionTerminationListener {

    void onUnhealthy(ClientConnection connection, ConnectionStats finalStats);
}
