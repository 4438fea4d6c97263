package com.fintech.marketcap.bus;

/**
 * Callback for messages delivered on a bus channel.
 * Handlers are invoked in publish order for a given channel. Exceptions are
 * logged by the bus and never reach the publisher.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * @param channel Channel the message was published on
     * @param payload JSON payload
     */
    void onMessage(String channel, String payload);
}
