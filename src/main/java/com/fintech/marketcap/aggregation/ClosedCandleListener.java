package com.fintech.marketcap.aggregation;

import com.fintech.marketcap.domain.CandleUpdate;
import com.fintech.marketcap.domain.Timeframe;

/**
 * Hook invoked when a real (non gap-filled) candle closes, e.g. to precompute
 * indicators. Runs on the aggregating thread while the candle stream is
 * locked, so implementations should hand off slow work. Exceptions are logged
 * and ignored.
 */
@FunctionalInterface
public interface ClosedCandleListener {

    void onCandleClosed(String tokenAddress, Timeframe timeframe, CandleUpdate closedCandle);
}
