package com.fintech.marketcap.bus;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Opens a {@link RedisBusBackend} from a {@code redis://[user:password@]host[:port][/db]}
 * URL ({@code rediss://} enables TLS) and pings it before handing it over.
 */
public class RedisBrokerConnector implements BrokerConnector {

    private static final Logger log = LoggerFactory.getLogger(RedisBrokerConnector.class);
    private static final int DEFAULT_PORT = 6379;

    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public RedisBrokerConnector(Duration timeout, CircuitBreaker circuitBreaker) {
        this.timeout = timeout;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public BusBackend connect(String brokerUrl, MessageHandler dispatcher) {
        URI uri = URI.create(brokerUrl);
        if (!"redis".equals(uri.getScheme()) && !"rediss".equals(uri.getScheme())) {
            throw new IllegalArgumentException("Unsupported broker URL scheme: " + uri.getScheme());
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(
            standaloneConfiguration(uri),
            clientConfiguration("rediss".equals(uri.getScheme()))
        );
        factory.afterPropertiesSet();

        try (RedisConnection connection = factory.getConnection()) {
            connection.ping();
        } catch (RuntimeException e) {
            factory.destroy();
            throw e;
        }

        log.info("Connected to Redis at {}:{}", uri.getHost(), uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT);
        return new RedisBusBackend(factory, circuitBreaker, dispatcher);
    }

    static RedisStandaloneConfiguration standaloneConfiguration(URI uri) {
        String host = uri.getHost() != null ? uri.getHost() : "localhost";
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(host, port);

        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            configuration.setDatabase(Integer.parseInt(path.substring(1)));
        }

        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int separator = userInfo.indexOf(':');
            if (separator >= 0) {
                String username = userInfo.substring(0, separator);
                if (!username.isEmpty()) {
                    configuration.setUsername(username);
                }
                configuration.setPassword(RedisPassword.of(userInfo.substring(separator + 1)));
            } else {
                configuration.setPassword(RedisPassword.of(userInfo));
            }
        }
        return configuration;
    }

    private LettuceClientConfiguration clientConfiguration(boolean ssl) {
        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder()
            .commandTimeout(timeout)
            .clientOptions(ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .build());
        if (ssl) {
            builder.useSsl();
        }
        return builder.build();
    }
}
