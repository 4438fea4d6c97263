package com.fintech.marketcap.domain;

import java.io.Serializable;

/**
 * Immutable executed swap, the aggregation input.
 *
 * @param signature Transaction signature
 * @param timestamp Execution time (Unix epoch millis)
 * @param source Venue that executed the swap
 * @param side Buy or sell
 * @param tokenAddress Mint address of the traded token
 * @param amountToken Token quantity exchanged
 * @param amountBase Base-asset quantity exchanged
 * @param priceUsd Token price in USD, must be positive to be aggregated
 * @param marketCapUsd Pre-computed market cap, used instead of price x supply when positive
 * @param trader Trader wallet address
 */
public record SwapEvent(
    String signature,
    long timestamp,
    SwapSource source,
    TradeSide side,
    String tokenAddress,
    double amountToken,
    double amountBase,
    double priceUsd,
    double marketCapUsd,
    String trader
) implements Serializable {

    /** Validates priceUsd > 0 (and finite) and a non-blank token address. */
    public boolean isValid() {
        return priceUsd > 0
            && Double.isFinite(priceUsd)
            && tokenAddress != null
            && !tokenAddress.isBlank();
    }

    /** Returns true if the feed supplied a usable market-cap override. */
    public boolean hasMarketCapOverride() {
        return marketCapUsd > 0 && Double.isFinite(marketCapUsd);
    }

    /** Returns traded notional in USD: amountToken x priceUsd (0.0 if negative or non-finite). */
    public double volumeUsd() {
        double volume = Math.abs(amountToken) * priceUsd;
        return Double.isFinite(volume) ? volume : 0.0;
    }
}
