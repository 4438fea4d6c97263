package com.fintech.marketcap.domain;

/**
 * Direction of a swap from the trader's point of view.
 */
public enum TradeSide {
    BUY,
    SELL
}
