package com.fintech.marketcap.delivery;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Comparator;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded outbound queue for one client connection, ordered by priority and
 * FIFO within a priority.
 *
 * <p>Admission rules, checked in order:
 * <ol>
 *   <li>At or above the drop threshold, LOW and NORMAL are dropped. HIGH and
 *       CRITICAL evict strictly lower-priority entries (lowest first, oldest
 *       first) until occupancy falls under half the capacity or nothing
 *       lower is left.</li>
 *   <li>If the queue is still full, the message is dropped.</li>
 *   <li>If the byte budget would be exceeded, anything below CRITICAL is
 *       dropped; CRITICAL evicts until it fits.</li>
 * </ol>
 * The entry count never exceeds {@code maxSize} and the byte total never
 * exceeds {@code maxBytes}.
 */
public class ClientQueue {

    private static final Comparator<QueuedMessage> DELIVERY_ORDER =
        Comparator.comparing(QueuedMessage::priority, Comparator.reverseOrder())
            .thenComparingLong(QueuedMessage::sequence);

    private final int maxSize;
    private final long maxBytes;
    private final double dropThreshold;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    // Guarded by lock
    private final TreeSet<QueuedMessage> entries = new TreeSet<>(DELIVERY_ORDER);
    private long bytes;
    private long nextSequence;
    private int consecutiveDrops;
    private long dropped;
    private long evicted;

    public ClientQueue(int maxSize, long maxBytes, double dropThreshold) {
        if (maxSize <= 0 || maxBytes <= 0) {
            throw new IllegalArgumentException("Queue limits must be positive: size=" + maxSize + ", bytes=" + maxBytes);
        }
        if (dropThreshold <= 0 || dropThreshold > 1) {
            throw new IllegalArgumentException("Drop threshold must be in (0, 1], got " + dropThreshold);
        }
        this.maxSize = maxSize;
        this.maxBytes = maxBytes;
        this.dropThreshold = dropThreshold;
    }

    /**
     * Offers a message under the admission rules.
     *
     * @return true if queued, false if dropped
     */
    public boolean offer(String payload, MessagePriority priority, String kind, Instant now) {
        int sizeBytes = payload.getBytes(StandardCharsets.UTF_8).length;

        lock.lock();
        try {
            if ((double) entries.size() / maxSize >= dropThreshold) {
                if (priority.isBelow(MessagePriority.HIGH)) {
                    return recordDrop();
                }
                evictLowerThan(priority);
            }

            if (entries.size() >= maxSize) {
                return recordDrop();
            }

            if (bytes + sizeBytes > maxBytes) {
                if (priority.isBelow(MessagePriority.CRITICAL) || sizeBytes > maxBytes) {
                    return recordDrop();
                }
                while (bytes + sizeBytes > maxBytes && !entries.isEmpty()) {
                    remove(oldestOfLowestPriority());
                    evicted++;
                }
            }

            entries.add(new QueuedMessage(payload, priority, now, kind, sizeBytes, nextSequence++));
            bytes += sizeBytes;
            consecutiveDrops = 0;
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void evictLowerThan(MessagePriority incoming) {
        while (entries.size() >= maxSize * 0.5 && !entries.isEmpty()) {
            QueuedMessage victim = oldestOfLowestPriority();
            if (!victim.priority().isBelow(incoming)) {
                return;
            }
            remove(victim);
            evicted++;
        }
    }

    /** Caller holds the lock and has checked the queue is non-empty. */
    private QueuedMessage oldestOfLowestPriority() {
        MessagePriority lowest = entries.last().priority();
        QueuedMessage bound = new QueuedMessage("", lowest, Instant.EPOCH, "", 0, Long.MIN_VALUE);
        return entries.ceiling(bound);
    }

    private void remove(QueuedMessage message) {
        if (entries.remove(message)) {
            bytes -= message.sizeBytes();
        }
    }

    private boolean recordDrop() {
        consecutiveDrops++;
        dropped++;
        return false;
    }

    /**
     * Removes the highest-priority, oldest message, waiting while the queue
     * is empty.
     */
    public QueuedMessage take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                notEmpty.await();
            }
            QueuedMessage head = entries.pollFirst();
            bytes -= head.sizeBytes();
            return head;
        } finally {
            lock.unlock();
        }
    }

    /** Like {@link #take()} but gives up after the timeout and returns null. */
    public QueuedMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            QueuedMessage head = entries.pollFirst();
            bytes -= head.sizeBytes();
            return head;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            bytes = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long bytes() {
        lock.lock();
        try {
            return bytes;
        } finally {
            lock.unlock();
        }
    }

    public int consecutiveDrops() {
        lock.lock();
        try {
            return consecutiveDrops;
        } finally {
            lock.unlock();
        }
    }

    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public long evicted() {
        lock.lock();
        try {
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public long maxBytes() {
        return maxBytes;
    }
}
