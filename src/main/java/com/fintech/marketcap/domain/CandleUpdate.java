package com.fintech.marketcap.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Incremental candle message published on {@code candles:{token}:{timeframe}}.
 *
 * @param token Token mint address
 * @param timeframe Timeframe label, e.g. "1m"
 * @param time Bucket start in epoch seconds
 * @param closed True when the bucket has been frozen
 */
public record CandleUpdate(
    String token,
    String timeframe,
    long time,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long trades,
    @JsonProperty("is_closed") boolean closed
) {

    public static CandleUpdate of(String token, Timeframe timeframe, Candle candle) {
        return new CandleUpdate(
            token,
            timeframe.label(),
            candle.timeSeconds(),
            candle.open(),
            candle.high(),
            candle.low(),
            candle.close(),
            candle.volume(),
            candle.trades(),
            candle.closed()
        );
    }
}
