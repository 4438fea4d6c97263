package com.fintech.marketcap.domain;

/**
 * Candle in the shape consumed by chart widgets (Lightweight Charts style).
 *
 * @param time Bucket start in epoch seconds
 */
public record ChartCandle(
    long time,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
}
