package com.fintech.marketcap.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Notice published on {@code supply_change:{token}} after a mint or burn
 * changes a token's circulating supply.
 */
public record SupplyChange(
    String token,
    @JsonProperty("old_supply") long oldSupply,
    @JsonProperty("new_supply") long newSupply,
    @JsonProperty("old_market_cap") double oldMarketCap,
    @JsonProperty("new_market_cap") double newMarketCap,
    long timestamp
) {
}
