package com.fintech.marketcap.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Venue that produced a swap. The set is closed: unknown tags are rejected
 * at the ingestion boundary instead of being silently ignored.
 */
public enum SwapSource {

    JUPITER("jupiter"),
    RAYDIUM("raydium"),
    PUMP_FUN("pump_fun"),
    METEORA("meteora"),
    ORCA("orca");

    private final String tag;

    SwapSource(String tag) {
        this.tag = tag;
    }

    /** Returns the wire tag used by upstream feeds (e.g. "pump_fun"). */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a wire tag, case-insensitively.
     *
     * @throws IllegalArgumentException if the tag names no known venue
     */
    public static SwapSource fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Swap source tag cannot be null");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(source -> source.tag.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown swap source: " + tag + ". Must be one of: " + Arrays.toString(values())));
    }
}
