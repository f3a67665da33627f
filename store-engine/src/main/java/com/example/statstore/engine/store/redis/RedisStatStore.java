package com.example.statstore.engine.store.redis;

import com.example.statstore.engine.error.AggregateOverflowException;
import com.example.statstore.engine.error.StatStoreException;
import com.example.statstore.engine.error.StoreTimeoutException;
import com.example.statstore.engine.error.StoreUnavailableException;
import com.example.statstore.engine.store.FoldCommand;
import com.example.statstore.engine.store.StatStore;
import com.example.statstore.engine.store.StoreValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link StatStore} on Redis through Spring Data Redis. The fold runs as one Lua script, which Redis
 * executes without interleaving any other command.
 */
@Slf4j
public class RedisStatStore implements StatStore {

    static final RedisScript<Long> FOLD_SCRIPT =
            RedisScript.of(new ClassPathResource("scripts/fold-observation.lua"), Long.class);

    private final StringRedisTemplate strings;
    private final RedisTemplate<String, byte[]> bytes;

    public RedisStatStore(StringRedisTemplate strings, RedisTemplate<String, byte[]> bytes) {
        this.strings = strings;
        this.bytes = bytes;
    }

    @Override
    public long fold(FoldCommand command) {
        String value = StoreValues.format(command.getValue());
        String squared = StoreValues.format(command.getValue() * command.getValue());
        Long count = translate("fold", () -> strings.execute(FOLD_SCRIPT, command.keys(),
                value,
                squared,
                command.getTimestamp(),
                command.getHistoryEntry(),
                String.valueOf(command.getHistorySize()),
                String.valueOf(command.getTtl().toSeconds())));
        if (count == null) {
            throw new StatStoreException("Fold script returned no count for " + command.getCountKey());
        }
        return count;
    }

    @Override
    public boolean putIfAbsent(String key, byte[] payload, Duration ttl) {
        return translate("putIfAbsent", () -> {
            boolean written = Boolean.TRUE.equals(bytes.opsForValue().setIfAbsent(key, payload, ttl));
            if (!written) {
                bytes.expire(key, ttl);
            }
            return written;
        });
    }

    @Override
    public List<String> getAll(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> values = translate("getAll", () -> strings.opsForValue().multiGet(keys));
        return values == null ? Collections.nCopies(keys.size(), null) : values;
    }

    @Override
    public List<byte[]> getAllBytes(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<byte[]> values = translate("getAllBytes", () -> bytes.opsForValue().multiGet(keys));
        return values == null ? Collections.nCopies(keys.size(), null) : values;
    }

    @Override
    public List<String> range(String key, long start, long stop) {
        List<String> values = translate("range", () -> strings.opsForList().range(key, start, stop));
        return values == null ? Collections.emptyList() : values;
    }

    @Override
    public Stream<String> scan(String pattern, int batchSize) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(batchSize).build();
        Cursor<String> cursor = translate("scan", () -> strings.scan(options));
        Iterator<String> keys = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return translate("scan", cursor::hasNext);
            }

            @Override
            public String next() {
                return translate("scan", cursor::next);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(keys, Spliterator.ORDERED), false)
                .onClose(cursor::close);
    }

    private static boolean isOverflow(DataAccessException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(AggregateOverflowException.MARKER);
    }

    private static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (QueryTimeoutException e) {
            throw new StoreTimeoutException("Redis " + operation + " timed out, outcome unknown", e);
        } catch (RedisConnectionFailureException e) {
            throw new StoreUnavailableException("Redis unavailable during " + operation, e);
        } catch (DataAccessException e) {
            if (isOverflow(e)) {
                throw new AggregateOverflowException("Redis " + operation + " refused: " + e.getMostSpecificCause().getMessage(), e);
            }
            log.debug("Redis {} failed", operation, e);
            throw new StatStoreException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
