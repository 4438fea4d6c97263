package com.fintech.marketcap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketcap.aggregation.AggregatorRegistry;
import com.fintech.marketcap.aggregation.ClosedCandleListener;
import com.fintech.marketcap.aggregation.SupplyCache;
import com.fintech.marketcap.bus.BrokerConnector;
import com.fintech.marketcap.bus.MessageBus;
import com.fintech.marketcap.bus.RedisBrokerConnector;
import com.fintech.marketcap.delivery.BackpressureController;
import com.fintech.marketcap.delivery.CandleStreamBridge;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the bus, aggregation and delivery components. Each is a single
 * application-scoped bean; nothing is reached through static state.
 */
@Configuration
public class ApplicationConfig {

    static final String BROKER_CIRCUIT_BREAKER = "broker";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SupplyCache supplyCache(MarketCapProperties properties, Clock clock) {
        return new SupplyCache(properties.getAggregation().getSupplyTtl(), clock);
    }

    @Bean
    public BrokerConnector brokerConnector(MarketCapProperties properties, CircuitBreakerRegistry circuitBreakerRegistry) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(BROKER_CIRCUIT_BREAKER);
        return new RedisBrokerConnector(properties.getBus().getConnectTimeout(), circuitBreaker);
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    public MessageBus messageBus(
            MarketCapProperties properties,
            BrokerConnector brokerConnector,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new MessageBus(properties.getBus().getBrokerUrl(), brokerConnector, objectMapper, clock, meterRegistry);
    }

    @Bean
    public AggregatorRegistry aggregatorRegistry(
            MarketCapProperties properties,
            MessageBus messageBus,
            SupplyCache supplyCache,
            ObjectProvider<ClosedCandleListener> closeListeners,
            Clock clock,
            MeterRegistry meterRegistry) {
        MarketCapProperties.Aggregation aggregation = properties.getAggregation();
        return new AggregatorRegistry(
            messageBus,
            supplyCache,
            aggregation.parsedTimeframes(),
            aggregation.getHistorySize(),
            aggregation.getDefaultSupply(),
            closeListeners.orderedStream().toList(),
            clock,
            meterRegistry
        );
    }

    @Bean(destroyMethod = "shutdown")
    public BackpressureController backpressureController(
            MarketCapProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        MarketCapProperties.Backpressure backpressure = properties.getBackpressure();
        return new BackpressureController(
            backpressure.getMaxQueueSize(),
            backpressure.getMaxQueueBytes(),
            backpressure.getDropThreshold(),
            backpressure.getMinSendInterval(),
            backpressure.getHealthFloor(),
            clock,
            meterRegistry
        );
    }

    @Bean
    public CandleStreamBridge candleStreamBridge(
            MessageBus messageBus,
            BackpressureController backpressureController,
            ObjectMapper objectMapper,
            Clock clock) {
        return new CandleStreamBridge(messageBus, backpressureController, objectMapper, clock);
    }
}
