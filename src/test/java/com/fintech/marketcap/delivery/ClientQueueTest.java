package com.fintech.marketcap.delivery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientQueue Tests")
class ClientQueueTest {

    private static final Instant NOW = Instant.EPOCH;
    private static final long LARGE_BUDGET = 10L * 1024 * 1024;

    private static boolean offer(ClientQueue queue, String payload, MessagePriority priority) {
        return queue.offer(payload, priority, "test", NOW);
    }

    private static List<String> drain(ClientQueue queue) throws InterruptedException {
        List<String> payloads = new ArrayList<>();
        QueuedMessage message;
        while ((message = queue.poll(0, TimeUnit.MILLISECONDS)) != null) {
            payloads.add(message.payload());
        }
        return payloads;
    }

    @Test
    @DisplayName("Delivers by priority, FIFO within a priority")
    void testPriorityOrder() throws InterruptedException {
        ClientQueue queue = new ClientQueue(100, LARGE_BUDGET, 0.8);

        offer(queue, "n1", MessagePriority.NORMAL);
        offer(queue, "l1", MessagePriority.LOW);
        offer(queue, "c1", MessagePriority.CRITICAL);
        offer(queue, "n2", MessagePriority.NORMAL);
        offer(queue, "h1", MessagePriority.HIGH);
        offer(queue, "c2", MessagePriority.CRITICAL);

        assertThat(drain(queue)).containsExactly("c1", "c2", "h1", "n1", "n2", "l1");
        assertThat(queue.bytes()).isZero();
    }

    @Test
    @DisplayName("NORMAL is dropped once occupancy reaches the threshold")
    void testNormalDroppedAboveThreshold() {
        ClientQueue queue = new ClientQueue(10, LARGE_BUDGET, 0.8);
        for (int i = 0; i < 8; i++) {
            assertThat(offer(queue, "m" + i, MessagePriority.NORMAL)).isTrue();
        }

        for (int i = 0; i < 5; i++) {
            assertThat(offer(queue, "x" + i, MessagePriority.NORMAL)).isFalse();
            assertThat(offer(queue, "y" + i, MessagePriority.LOW)).isFalse();
        }

        assertThat(queue.size()).isEqualTo(8);
        assertThat(queue.consecutiveDrops()).isEqualTo(10);
        assertThat(queue.dropped()).isEqualTo(10);
    }

    @Test
    @DisplayName("CRITICAL into a full queue of low entries evicts and stays within capacity")
    void testCriticalEvictsWhenFull() throws InterruptedException {
        ClientQueue queue = new ClientQueue(10, LARGE_BUDGET, 1.0);
        for (int i = 0; i < 5; i++) {
            offer(queue, "n" + i, MessagePriority.NORMAL);
            offer(queue, "l" + i, MessagePriority.LOW);
        }
        assertThat(queue.size()).isEqualTo(10);

        assertThat(offer(queue, "critical", MessagePriority.CRITICAL)).isTrue();

        assertThat(queue.size()).isLessThanOrEqualTo(10);
        assertThat(queue.consecutiveDrops()).isZero();
        List<String> remaining = drain(queue);
        assertThat(remaining.get(0)).isEqualTo("critical");
        // LOW entries go first, oldest first
        assertThat(remaining).doesNotContain("l0", "l1", "l2", "l3", "l4");
    }

    @Test
    @DisplayName("HIGH evicts lower priorities until occupancy is under half")
    void testHighEvictsToHalf() throws InterruptedException {
        ClientQueue queue = new ClientQueue(10, LARGE_BUDGET, 0.8);
        for (int i = 0; i < 8; i++) {
            offer(queue, "n" + i, MessagePriority.NORMAL);
        }

        assertThat(offer(queue, "high", MessagePriority.HIGH)).isTrue();

        // 8 -> 4 by eviction, then the HIGH message is added
        assertThat(queue.size()).isEqualTo(5);
        assertThat(queue.evicted()).isEqualTo(4);
        assertThat(drain(queue)).containsExactly("high", "n4", "n5", "n6", "n7");
    }

    @Test
    @DisplayName("HIGH is dropped when only equal or higher priorities fill the queue")
    void testHighDroppedWhenNothingLower() {
        ClientQueue queue = new ClientQueue(4, LARGE_BUDGET, 0.8);
        for (int i = 0; i < 4; i++) {
            offer(queue, "c" + i, MessagePriority.CRITICAL);
        }

        assertThat(offer(queue, "high", MessagePriority.HIGH)).isFalse();
        assertThat(offer(queue, "critical", MessagePriority.CRITICAL)).isFalse();
        assertThat(queue.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Byte budget: non-critical is dropped, CRITICAL evicts until it fits")
    void testByteBudget() throws InterruptedException {
        ClientQueue queue = new ClientQueue(100, 30, 0.8);
        offer(queue, "aaaaaaaaaa", MessagePriority.LOW);
        offer(queue, "bbbbbbbbbb", MessagePriority.NORMAL);
        offer(queue, "cccccccccc", MessagePriority.HIGH);
        assertThat(queue.bytes()).isEqualTo(30);

        assertThat(offer(queue, "dddddddddd", MessagePriority.HIGH)).isFalse();
        assertThat(offer(queue, "eeeeeeeeeeeeeee", MessagePriority.CRITICAL)).isTrue();

        assertThat(queue.bytes()).isLessThanOrEqualTo(30);
        assertThat(drain(queue)).containsExactly("eeeeeeeeeeeeeee", "cccccccccc");
    }

    @Test
    @DisplayName("A message larger than the whole budget is dropped")
    void testOversizedMessage() {
        ClientQueue queue = new ClientQueue(100, 8, 0.8);

        assertThat(offer(queue, "123456789", MessagePriority.CRITICAL)).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Size counts UTF-8 bytes")
    void testUtf8Size() {
        ClientQueue queue = new ClientQueue(100, LARGE_BUDGET, 0.8);

        offer(queue, "é", MessagePriority.NORMAL);

        assertThat(queue.bytes()).isEqualTo(2);
    }

    @Test
    @DisplayName("take blocks until a message arrives")
    void testTakeBlocks() throws Exception {
        ClientQueue queue = new ClientQueue(10, LARGE_BUDGET, 0.8);
        List<String> taken = new ArrayList<>();
        Thread consumer = new Thread(() -> {
            try {
                taken.add(queue.take().payload());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        Thread.sleep(50);
        assertThat(taken).isEmpty();
        offer(queue, "hello", MessagePriority.NORMAL);
        consumer.join(1000);

        assertThat(taken).containsExactly("hello");
    }

    @Test
    @DisplayName("Successful enqueue resets consecutive drops")
    void testConsecutiveDropsReset() {
        ClientQueue queue = new ClientQueue(10, LARGE_BUDGET, 0.8);
        for (int i = 0; i < 8; i++) {
            offer(queue, "n" + i, MessagePriority.NORMAL);
        }
        offer(queue, "dropped", MessagePriority.NORMAL);
        assertThat(queue.consecutiveDrops()).isEqualTo(1);

        offer(queue, "high", MessagePriority.HIGH);

        assertThat(queue.consecutiveDrops()).isZero();
    }

    @Test
    @DisplayName("Concurrent producers and a consumer keep both budgets and account for every message")
    void testConcurrentProducers() throws Exception {
        ClientQueue queue = new ClientQueue(20, 2_000L, 0.8);
        String payload = "p".repeat(150);
        MessagePriority[] priorities = MessagePriority.values();
        int producers = 8;
        int perProducer = 500;
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger taken = new AtomicInteger();
        AtomicBoolean producing = new AtomicBoolean(true);

        ExecutorService executor = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> consumer = executor.submit(() -> {
                start.await();
                while (producing.get() || queue.size() > 0) {
                    if (queue.poll(1, TimeUnit.MILLISECONDS) != null) {
                        taken.incrementAndGet();
                    }
                }
                return null;
            });
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        if (queue.offer(payload, priorities[(producer + i) % priorities.length], "test", NOW)) {
                            accepted.incrementAndGet();
                        }
                        assertThat(queue.size()).isLessThanOrEqualTo(20);
                        assertThat(queue.bytes()).isLessThanOrEqualTo(2_000L);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            producing.set(false);
            consumer.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(accepted.get() + queue.dropped()).isEqualTo(producers * perProducer);
        assertThat((long) accepted.get()).isEqualTo(taken.get() + queue.evicted());
        assertThat(queue.size()).isZero();
        assertThat(queue.bytes()).isZero();
    }
}
