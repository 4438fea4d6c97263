package com.fintech.marketcap.bus;

/**
 * Opens a durable broker backend. Implementations must verify the broker is
 * reachable and throw if it is not, so the bus can fall back.
 */
@FunctionalInterface
public interface BrokerConnector {

    BusBackend connect(String brokerUrl, MessageHandler dispatcher) throws Exception;
}
