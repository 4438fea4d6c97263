package com.fintech.marketcap.bus;

import com.fintech.marketcap.util.NamedThreadFactory;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Redis pub/sub and cache backend.
 *
 * <p>Received messages are handed to the bus on a single listener thread so
 * each channel is observed in publish order. Publish and cache calls run
 * through the {@code broker} circuit breaker; while it is open they are
 * skipped.
 */
public class RedisBusBackend implements BusBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisBusBackend.class);

    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate template;
    private final RedisMessageListenerContainer container;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService listenerExecutor;
    private final MessageListener listener;

    // Guarded by this; the container starts on first subscription
    private boolean containerStarted;
    private boolean closed;

    public RedisBusBackend(
            LettuceConnectionFactory connectionFactory,
            CircuitBreaker circuitBreaker,
            MessageHandler dispatcher) {
        this(connectionFactory, new StringRedisTemplate(connectionFactory), new RedisMessageListenerContainer(),
            circuitBreaker, dispatcher);
    }

    RedisBusBackend(
            LettuceConnectionFactory connectionFactory,
            StringRedisTemplate template,
            RedisMessageListenerContainer container,
            CircuitBreaker circuitBreaker,
            MessageHandler dispatcher) {
        this.connectionFactory = connectionFactory;
        this.template = template;
        this.container = container;
        this.circuitBreaker = circuitBreaker;
        this.listenerExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("bus-listener", true));
        this.listener = (message, pattern) -> dispatcher.onMessage(
            new String(message.getChannel(), StandardCharsets.UTF_8),
            new String(message.getBody(), StandardCharsets.UTF_8)
        );
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public void publish(String channel, String payload) {
        try {
            circuitBreaker.executeRunnable(() -> template.convertAndSend(channel, payload));
        } catch (CallNotPermittedException e) {
            log.debug("Broker circuit open, skipping publish to {}", channel);
        }
    }

    @Override
    public synchronized void subscribeChannel(String channel) {
        if (closed) {
            return;
        }
        if (!containerStarted) {
            container.setConnectionFactory(connectionFactory);
            container.setTaskExecutor(listenerExecutor);
            container.afterPropertiesSet();
            container.start();
            containerStarted = true;
            log.info("Redis listener container started");
        }
        container.addMessageListener(listener, new ChannelTopic(channel));
        log.info("Subscribed to channel: {}", channel);
    }

    @Override
    public synchronized void unsubscribeChannel(String channel) {
        if (containerStarted) {
            container.removeMessageListener(listener, new ChannelTopic(channel));
            log.info("Unsubscribed from channel: {}", channel);
        }
    }

    @Override
    public void cacheSet(String key, String value, Duration ttl) {
        try {
            circuitBreaker.executeRunnable(() -> template.opsForValue().set(key, value, ttl));
        } catch (CallNotPermittedException e) {
            log.debug("Broker circuit open, skipping cache write for {}", key);
        }
    }

    @Override
    public Optional<String> cacheGet(String key) {
        try {
            return Optional.ofNullable(circuitBreaker.executeSupplier(() -> template.opsForValue().get(key)));
        } catch (CallNotPermittedException e) {
            log.debug("Broker circuit open, cache miss for {}", key);
            return Optional.empty();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (containerStarted) {
                container.stop();
                container.destroy();
            }
        } catch (Exception e) {
            log.warn("Error stopping Redis listener container: {}", e.getMessage());
        } finally {
            containerStarted = false;
            listenerExecutor.shutdownNow();
            connectionFactory.destroy();
            log.info("Disconnected from Redis");
        }
    }
}
