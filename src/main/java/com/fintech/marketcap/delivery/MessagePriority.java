package com.fintech.marketcap.delivery;

/**
 * Delivery priority of an outbound message, lowest first.
 * Under pressure LOW and NORMAL are dropped, HIGH and CRITICAL evict
 * lower-priority entries, and only CRITICAL may exceed the byte budget by
 * evicting.
 */
public enum MessagePriority {

    /** Cosmetic or easily recomputed data. */
    LOW,

    /** Open-candle ticks, superseded by the next one. */
    NORMAL,

    /** Status and supply notices. */
    HIGH,

    /** Closed candles and other messages a client cannot reconstruct. */
    CRITICAL;

    public boolean isBelow(MessagePriority other) {
        return compareTo(other) < 0;
    }
}
