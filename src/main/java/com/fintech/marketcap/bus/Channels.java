package com.fintech.marketcap.bus;

import com.fintech.marketcap.domain.Timeframe;

import java.util.Optional;

/**
 * Channel and cache key naming shared by publishers and subscribers.
 */
public final class Channels {

    public static final String CANDLES_PREFIX = "candles:";
    public static final String SUPPLY_CHANGE_PREFIX = "supply_change:";
    public static final String SWAPS_PREFIX = "swaps:";

    private Channels() {
    }

    /** candles:{token}:{timeframe label} */
    public static String candles(String tokenAddress, Timeframe timeframe) {
        return CANDLES_PREFIX + tokenAddress + ":" + timeframe.label();
    }

    /** supply_change:{token} */
    public static String supplyChange(String tokenAddress) {
        return SUPPLY_CHANGE_PREFIX + tokenAddress;
    }

    /** swaps:{token} */
    public static String swaps(String tokenAddress) {
        return SWAPS_PREFIX + tokenAddress;
    }

    /** token_supply:{token}, cache key for the last known circulating supply. */
    public static String tokenSupplyKey(String tokenAddress) {
        return "token_supply:" + tokenAddress;
    }

    /** token_info:{token}, cache key for token metadata. */
    public static String tokenInfoKey(String tokenAddress) {
        return "token_info:" + tokenAddress;
    }

    /** quote:{input}:{output}:{amount}, cache key for swap quotes. */
    public static String quoteKey(String inputMint, String outputMint, long amount) {
        return "quote:" + inputMint + ":" + outputMint + ":" + amount;
    }

    /**
     * Extracts the token address from a per-token channel name.
     * Returns empty for channels that are not token scoped.
     */
    public static Optional<String> tokenOf(String channel) {
        for (String prefix : new String[] {CANDLES_PREFIX, SUPPLY_CHANGE_PREFIX, SWAPS_PREFIX}) {
            if (channel.startsWith(prefix)) {
                String rest = channel.substring(prefix.length());
                int separator = rest.indexOf(':');
                String token = separator >= 0 ? rest.substring(0, separator) : rest;
                return token.isEmpty() ? Optional.empty() : Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
