package com.fintech.marketcap.delivery;

import java.time.Instant;

/**
 * Entry in a client's outbound queue.
 *
 * @param payload Serialized message
 * @param priority Delivery priority
 * @param enqueuedAt When the message was accepted
 * @param kind Message type for logs ("candle", "supply_change", ...)
 * @param sizeBytes UTF-8 size of the payload
 * @param sequence Per-queue insertion counter, breaks ties within a priority
 */
public record QueuedMessage(
    String payload,
    MessagePriority priority,
    Instant enqueuedAt,
    String kind,
    int sizeBytes,
    long sequence
) {
}
