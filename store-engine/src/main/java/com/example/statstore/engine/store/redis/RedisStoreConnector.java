package com.example.statstore.engine.store.redis;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnection;
import com.example.statstore.engine.connection.StoreConnector;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.net.URI;
import java.util.Set;

/**
 * Opens a Lettuce connection factory for {@code redis://} and {@code rediss://} URLs. Lettuce
 * connections are thread-safe, so one shared native connection serves reader and writer alike.
 */
@Slf4j
public class RedisStoreConnector implements StoreConnector {

    private static final Set<String> SCHEMES = Set.of("redis", "rediss");

    @Override
    public boolean supports(URI url) {
        return url.getScheme() != null && SCHEMES.contains(url.getScheme().toLowerCase());
    }

    @Override
    public StoreConnection connect(URI url, StatsSettings settings) {
        RedisURI redisUri = RedisURI.create(url);

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redisUri.getHost(), redisUri.getPort());
        server.setDatabase(redisUri.getDatabase());
        if (redisUri.getUsername() != null) {
            server.setUsername(redisUri.getUsername());
        }
        if (redisUri.getPassword() != null) {
            server.setPassword(RedisPassword.of(redisUri.getPassword()));
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(settings.getCommandTimeout());
        if (redisUri.isSsl()) {
            client.useSsl();
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, client.build());
        factory.afterPropertiesSet();
        factory.start();

        StringRedisTemplate strings = new StringRedisTemplate(factory);

        RedisTemplate<String, byte[]> bytes = new RedisTemplate<>();
        bytes.setConnectionFactory(factory);
        bytes.setKeySerializer(RedisSerializer.string());
        bytes.setValueSerializer(RedisSerializer.byteArray());
        bytes.afterPropertiesSet();

        log.info("Opened Redis connection factory for {}:{} db {}", redisUri.getHost(), redisUri.getPort(), redisUri.getDatabase());
        RedisStatStore store = new RedisStatStore(strings, bytes);
        return new StoreConnection(store, store, () -> {
            factory.destroy();
            log.info("Closed Redis connection factory for {}:{}", redisUri.getHost(), redisUri.getPort());
        });
    }
}
