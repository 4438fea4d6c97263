package com.fintech.marketcap.maintenance;

import com.fintech.marketcap.aggregation.AggregatorRegistry;
import com.fintech.marketcap.bus.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cleanup of time-limited state: stale token supplies and expired
 * entries of the in-memory bus cache.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final AggregatorRegistry registry;
    private final MessageBus messageBus;

    public MaintenanceScheduler(AggregatorRegistry registry, MessageBus messageBus) {
        this.registry = registry;
        this.messageBus = messageBus;
    }

    @Scheduled(fixedDelayString = "${marketcap.aggregation.supply-sweep-interval-ms:60000}")
    public void evictStaleSupplies() {
        int removed = registry.evictStaleSupplies();
        if (removed > 0) {
            log.info("Evicted {} stale token supplies", removed);
        }
    }

    @Scheduled(fixedDelayString = "${marketcap.bus.cache-sweep-interval-ms:30000}")
    public void sweepBusCache() {
        messageBus.sweepExpiredCache();
    }
}
