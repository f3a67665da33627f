package com.example.statstore.engine.store;

import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * The backing key-value store as the engine sees it. Every method is one round trip and may block;
 * implementations translate driver failures into the engine's exception hierarchy.
 */
public interface StatStore {

    /**
     * Applies the aggregate fold, the capped history push and the TTL refresh of one observation as
     * a single indivisible unit.
     *
     * @return the label's count after the fold
     */
    long fold(FoldCommand command);

    /**
     * Writes {@code payload} only if {@code key} is absent, and refreshes the key's TTL either way.
     *
     * @return true if this call wrote the payload
     */
    boolean putIfAbsent(String key, byte[] payload, Duration ttl);

    // Missing keys come back as null, positionally aligned with the request
    List<String> getAll(List<String> keys);

    List<byte[]> getAllBytes(List<String> keys);

    List<String> range(String key, long start, long stop);

    /**
     * Cursor-based scan over keys matching a glob. The stream must be closed to release the cursor;
     * it may contain duplicates.
     */
    Stream<String> scan(String pattern, int batchSize);
}
