package com.fintech.marketcap.domain;

import java.io.Serializable;

/**
 * Immutable OHLCV snapshot of one market-cap bucket.
 * OHLC values are market capitalization in USD, not price.
 *
 * @param time Bucket start timestamp (epoch-aligned millis)
 * @param open Market cap of the first swap in the bucket
 * @param high Maximum market cap (must be >= open, close, low)
 * @param low Minimum market cap (must be <= open, close, high)
 * @param close Market cap of the latest swap
 * @param volume Cumulative USD volume
 * @param trades Number of swaps aggregated
 * @param closed True once the bucket is frozen into history
 */
public record Candle(
    long time,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long trades,
    boolean closed
) implements Serializable {

    /**
     * Validates OHLC invariants: high >= {open,close,low}, low <= {open,close,high}.
     */
    public Candle {
        if (high < low) {
            throw new IllegalArgumentException(
                "High market cap (" + high + ") cannot be less than low market cap (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High market cap (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low market cap (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume < 0 || trades < 0) {
            throw new IllegalArgumentException(
                "Volume (" + volume + ") and trades (" + trades + ") cannot be negative"
            );
        }
    }

    /**
     * Creates a flat, closed, zero-volume candle for a bucket without swaps.
     *
     * @param time Bucket start timestamp
     * @param previousClose Close of the last real candle
     */
    public static Candle gapFill(long time, double previousClose) {
        return new Candle(time, previousClose, previousClose, previousClose, previousClose, 0.0, 0, true);
    }

    /** Returns true for synthesized buckets that saw no swaps. */
    public boolean isGapFill() {
        return trades == 0;
    }

    /** Returns bucket start in epoch seconds, the unit chart libraries expect. */
    public long timeSeconds() {
        return Math.floorDiv(time, 1000L);
    }

    /** Returns market-cap range (high - low). */
    public double range() {
        return high - low;
    }

    /** Returns the chart representation {time (s), open, high, low, close, volume}. */
    public ChartCandle toChartPoint() {
        return new ChartCandle(timeSeconds(), open, high, low, close, volume);
    }
}
