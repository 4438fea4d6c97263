package com.fintech.marketcap.delivery;

import com.fintech.marketcap.util.NamedThreadFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Per-connection bounded queues with priority-aware dropping, each drained
 * by its own delivery loop.
 *
 * <p>Each loop sends at most one message per {@code minSendInterval} and
 * tracks a health score: +0.01 per successful send (capped at 1.0), -0.1 per
 * failure (floored at 0). When health drops under the floor the loop stops
 * and {@link ConnectionTerminationListener}s are notified; the connection
 * stays registered until someone calls {@link #unregister}.
 */
public class BackpressureController {

    private static final Logger log = LoggerFactory.getLogger(BackpressureController.class);

    private static final double HEALTH_GAIN = 0.01;
    private static final double HEALTH_PENALTY = 0.1;

    private final int maxQueueSize;
    private final long maxQueueBytes;
    private final double dropThreshold;
    private final long minSendIntervalNanos;
    private final double healthFloor;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<ConnectionTerminationListener> terminationListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor =
        Executors.newCachedThreadPool(new NamedThreadFactory("delivery", true));

    private final Counter enqueuedCounter;
    private final Counter droppedCounter;
    private final Counter sendFailureCounter;

    public BackpressureController(
            int maxQueueSize,
            long maxQueueBytes,
            double dropThreshold,
            Duration minSendInterval,
            double healthFloor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.maxQueueSize = maxQueueSize;
        this.maxQueueBytes = maxQueueBytes;
        this.dropThreshold = dropThreshold;
        this.minSendIntervalNanos = minSendInterval.toNanos();
        this.healthFloor = healthFloor;
        this.clock = clock;

        this.enqueuedCounter = meterRegistry.counter("marketcap.backpressure.enqueued");
        this.droppedCounter = meterRegistry.counter("marketcap.backpressure.dropped");
        this.sendFailureCounter = meterRegistry.counter("marketcap.backpressure.send.failures");
        meterRegistry.gauge("marketcap.backpressure.connections", sessions, Map::size);

        log.info("Backpressure controller initialized: maxQueueSize={}, maxQueueBytes={}, dropThreshold={}, minSendInterval={}",
                maxQueueSize, maxQueueBytes, dropThreshold, minSendInterval);
    }

    public void addTerminationListener(ConnectionTerminationListener listener) {
        terminationListeners.add(listener);
    }

    /**
     * Creates the queue for a connection and starts its delivery loop.
     *
     * @return false if a connection with the same id is already registered
     */
    public boolean register(ClientConnection connection) {
        Session session = new Session(connection, new ClientQueue(maxQueueSize, maxQueueBytes, dropThreshold));
        if (sessions.putIfAbsent(connection.id(), session) != null) {
            log.warn("Connection {} already registered", connection.id());
            return false;
        }
        session.loop = deliveryExecutor.submit(() -> deliver(session));
        if (!session.delivering) {
            // Unregistered before the loop handle was published
            session.loop.cancel(true);
        }
        log.info("Registered connection {}", connection.id());
        return true;
    }

    /**
     * Offers a message to a connection's queue.
     *
     * @return false if the connection is unknown, its delivery loop has
     *         stopped, or the message was dropped
     */
    public boolean enqueue(String connectionId, String payload, MessagePriority priority, String kind) {
        Session session = sessions.get(connectionId);
        if (session == null) {
            return false;
        }
        if (!session.delivering) {
            droppedCounter.increment();
            log.debug("Dropped {} message for {}: delivery stopped", kind, connectionId);
            return false;
        }
        boolean accepted = session.queue.offer(payload, priority, kind, clock.instant());
        if (accepted) {
            enqueuedCounter.increment();
        } else {
            droppedCounter.increment();
            log.debug("Dropped {} message ({}) for {}: queue={}, bytes={}",
                     kind, priority, connectionId, session.queue.size(), session.queue.bytes());
        }
        return accepted;
    }

    /**
     * Stops the delivery loop and discards the queue. Pending messages are
     * lost. Unknown ids are ignored.
     */
    public void unregister(String connectionId) {
        Session session = sessions.remove(connectionId);
        if (session == null) {
            return;
        }
        session.delivering = false;
        Future<?> loop = session.loop;
        if (loop != null) {
            loop.cancel(true);
        }
        session.queue.clear();
        log.info("Unregistered connection {} (delivered={}, dropped={})",
                connectionId, session.delivered, session.queue.dropped());
    }

    public Optional<ConnectionStats> getStats(String connectionId) {
        Session session = sessions.get(connectionId);
        return session == null ? Optional.empty() : Optional.of(session.stats());
    }

    public boolean isRegistered(String connectionId) {
        return sessions.containsKey(connectionId);
    }

    public int connectionCount() {
        return sessions.size();
    }

    /** Unregisters every connection and stops the delivery threads. */
    public void shutdown() {
        log.info("Shutting down backpressure controller ({} connections)", sessions.size());
        List.copyOf(sessions.keySet()).forEach(this::unregister);
        deliveryExecutor.shutdownNow();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Delivery threads did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deliver(Session session) {
        ClientConnection connection = session.connection;
        long lastSendNanos = 0;

        while (session.delivering && !Thread.currentThread().isInterrupted()) {
            QueuedMessage message;
            try {
                message = session.queue.take();
                if (lastSendNanos != 0) {
                    long wait = minSendIntervalNanos - (System.nanoTime() - lastSendNanos);
                    if (wait > 0) {
                        TimeUnit.NANOSECONDS.sleep(wait);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                connection.send(message.payload());
                long now = System.nanoTime();
                if (lastSendNanos != 0) {
                    double elapsedSeconds = (now - lastSendNanos) / 1_000_000_000.0;
                    session.sendRate = elapsedSeconds > 0 ? 1.0 / elapsedSeconds : session.sendRate;
                }
                lastSendNanos = now;
                session.delivered++;
                session.health = Math.min(1.0, session.health + HEALTH_GAIN);
            } catch (IOException | RuntimeException e) {
                sendFailureCounter.increment();
                session.health = Math.max(0.0, session.health - HEALTH_PENALTY);
                log.error("Send to {} failed (health={}): {}",
                         connection.id(), String.format("%.2f", session.health), e.getMessage());
                if (session.health < healthFloor) {
                    session.delivering = false;
                    log.warn("Connection {} unhealthy, stopping delivery", connection.id());
                    notifyUnhealthy(session);
                    return;
                }
            }
        }
        log.debug("Delivery loop for {} exited", connection.id());
    }

    private void notifyUnhealthy(Session session) {
        ConnectionStats finalStats = session.stats();
        for (ConnectionTerminationListener listener : terminationListeners) {
            try {
                listener.onUnhealthy(session.connection, finalStats);
            } catch (RuntimeException e) {
                log.error("Termination listener failed for {}", session.connection.id(), e);
            }
        }
    }

    /**
     * Queue plus delivery state of one connection. Health, rate and the
     * delivered count are written only by the delivery loop.
     */
    private static final class Session {
        final ClientConnection connection;
        final ClientQueue queue;
        volatile Future<?> loop;
        volatile boolean delivering = true;
        volatile double health = 1.0;
        volatile double sendRate;
        volatile long delivered;

        Session(ClientConnection connection, ClientQueue queue) {
            this.connection = connection;
            this.queue = queue;
        }

        ConnectionStats stats() {
            return new ConnectionStats(
                connection.id(),
                queue.size(),
                queue.bytes(),
                queue.maxSize(),
                queue.maxBytes(),
                health,
                sendRate,
                queue.consecutiveDrops(),
                delivered,
                queue.dropped(),
                delivering
            );
        }
    }
}
