package com.fintech.marketcap.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SwapEvent Tests")
class SwapEventTest {

    private static SwapEvent swap(String token, double amountToken, double priceUsd, double marketCapUsd) {
        return new SwapEvent("sig", 1_000L, SwapSource.JUPITER, TradeSide.BUY,
            token, amountToken, 1.0, priceUsd, marketCapUsd, "trader");
    }

    @Test
    @DisplayName("Positive price and token address are valid")
    void testValid() {
        assertThat(swap("TOKEN", 10, 0.5, 0).isValid()).isTrue();
    }

    @Test
    @DisplayName("Zero, negative and non-finite prices are invalid")
    void testInvalidPrice() {
        assertThat(swap("TOKEN", 10, 0.0, 0).isValid()).isFalse();
        assertThat(swap("TOKEN", 10, -1.0, 0).isValid()).isFalse();
        assertThat(swap("TOKEN", 10, Double.NaN, 0).isValid()).isFalse();
        assertThat(swap("TOKEN", 10, Double.POSITIVE_INFINITY, 0).isValid()).isFalse();
    }

    @Test
    @DisplayName("Blank token address is invalid")
    void testBlankToken() {
        assertThat(swap(" ", 10, 1.0, 0).isValid()).isFalse();
        assertThat(swap(null, 10, 1.0, 0).isValid()).isFalse();
    }

    @Test
    @DisplayName("Market cap override only when positive")
    void testMarketCapOverride() {
        assertThat(swap("TOKEN", 10, 1.0, 5_000).hasMarketCapOverride()).isTrue();
        assertThat(swap("TOKEN", 10, 1.0, 0).hasMarketCapOverride()).isFalse();
        assertThat(swap("TOKEN", 10, 1.0, -5).hasMarketCapOverride()).isFalse();
    }

    @Test
    @DisplayName("USD volume is token amount times price")
    void testVolumeUsd() {
        assertThat(swap("TOKEN", 200, 0.25, 0).volumeUsd()).isEqualTo(50.0);
        assertThat(swap("TOKEN", -200, 0.25, 0).volumeUsd()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Swap sources resolve from wire tags")
    void testSwapSourceTags() {
        assertThat(SwapSource.fromTag("pump_fun")).isEqualTo(SwapSource.PUMP_FUN);
        assertThat(SwapSource.fromTag(" RAYDIUM ")).isEqualTo(SwapSource.RAYDIUM);
        assertThat(SwapSource.ORCA.tag()).isEqualTo("orca");

        assertThatThrownBy(() -> SwapSource.fromTag("uniswap"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown swap source");
    }
}
