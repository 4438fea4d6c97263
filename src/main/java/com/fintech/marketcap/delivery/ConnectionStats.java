package com.fintech.marketcap.delivery;

/**
 * Point-in-time view of one connection's queue and delivery health.
 *
 * @param sendRate Messages per second, from the interval between the last two sends
 * @param delivering False once the delivery loop has stopped
 */
public record ConnectionStats(
    String connectionId,
    int queueSize,
    long queueBytes,
    int maxQueueSize,
    long maxQueueBytes,
    double healthScore,
    double sendRate,
    int consecutiveDrops,
    long delivered,
    long dropped,
    boolean delivering
) {
}
