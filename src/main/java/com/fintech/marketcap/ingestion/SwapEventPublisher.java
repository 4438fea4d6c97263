package com.fintech.marketcap.ingestion;

import com.fintech.marketcap.aggregation.AggregatorRegistry;
import com.fintech.marketcap.config.MarketCapProperties;
import com.fintech.marketcap.domain.SwapEvent;
import com.lmax.disruptor.*;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Input boundary for swaps: an LMAX Disruptor ring buffer in front of the
 * {@link AggregatorRegistry}.
 *
 * Producers never touch aggregator state. With several consumers every
 * consumer sees every slot but only handles the tokens that hash to it, so
 * swaps of one token are always applied by the same thread in ring order.
 */
@Component
public class SwapEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SwapEventPublisher.class);

    private final AggregatorRegistry registry;
    private final MarketCapProperties.Ingestion settings;

    private final AtomicLong ringBufferEventsDropped = new AtomicLong(0);
    private final AtomicLong eventsPublished = new AtomicLong(0);

    private Disruptor<SwapEventSlot> disruptor;
    private RingBuffer<SwapEventSlot> ringBuffer;

    public SwapEventPublisher(AggregatorRegistry registry, MarketCapProperties properties, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.settings = properties.getIngestion();

        meterRegistry.gauge("ingestion.ringbuffer.events.dropped", ringBufferEventsDropped);
        meterRegistry.gauge("ingestion.ringbuffer.events.published", eventsPublished);
    }

    @PostConstruct
    public void start() {
        int bufferSize = settings.getBufferSize();

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("swap-ingestion-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            SwapEventSlot::new,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        int numConsumers = Math.max(1, settings.getNumConsumers());
        if (numConsumers == 1) {
            disruptor.handleEventsWith(this::handleEvent);
            log.info("Disruptor configured with single consumer thread");
        } else {
            @SuppressWarnings("unchecked")
            EventHandler<SwapEventSlot>[] handlers = new EventHandler[numConsumers];
            for (int i = 0; i < numConsumers; i++) {
                final int shard = i;
                handlers[i] = (slot, sequence, endOfBatch) -> {
                    SwapEvent swap = slot.swap;
                    if (swap != null && shardOf(swap.tokenAddress(), numConsumers) == shard) {
                        registry.processSwap(swap);
                        if (log.isTraceEnabled()) {
                            log.trace("Shard {} processed swap {} at sequence {}", shard, swap.signature(), sequence);
                        }
                    }
                };
            }
            disruptor.handleEventsWith(handlers);
            log.info("Disruptor configured with {} token-sharded consumer threads", numConsumers);
        }

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<SwapEventSlot>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, SwapEventSlot slot) {
                log.error("Exception processing swap at sequence {}: {}", sequence, slot.swap, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Swap ring buffer started: bufferSize={}, waitStrategy={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
    }

    static int shardOf(String tokenAddress, int shards) {
        return Math.floorMod(tokenAddress == null ? 0 : tokenAddress.hashCode(), shards);
    }

    /**
     * Publishes a swap, blocking while the ring buffer is full.
     */
    public void publish(SwapEvent swap) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).swap = swap;
        } finally {
            ringBuffer.publish(sequence);
        }
        eventsPublished.incrementAndGet();
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the ring buffer is full; the swap is dropped and counted
     */
    public boolean tryPublish(SwapEvent swap) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).swap = swap;
            } finally {
                ringBuffer.publish(sequence);
            }
            eventsPublished.incrementAndGet();
            return true;
        } catch (InsufficientCapacityException e) {
            ringBufferEventsDropped.incrementAndGet();
            return false;
        }
    }

    private void handleEvent(SwapEventSlot slot, long sequence, boolean endOfBatch) {
        if (slot.swap != null) {
            registry.processSwap(slot.swap);

            if (endOfBatch && log.isTraceEnabled()) {
                log.trace("Processed swap at sequence {}, end of batch", sequence);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down swap ring buffer...");
            disruptor.shutdown();
            log.info("Swap ring buffer shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = settings.getWaitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /** Pre-allocated ring buffer slot. */
    private static class SwapEventSlot {
        SwapEvent swap;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public long getRingBufferEventsDropped() {
        return ringBufferEventsDropped.get();
    }

    public long getEventsPublished() {
        return eventsPublished.get();
    }
}
