package com.example.statstore.engine.context;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.connection.StoreLease;
import com.example.statstore.engine.error.InvalidContextException;
import com.example.statstore.engine.key.KeyCodec;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Contexts live under the SHA-256 of their bytes; a rewrite only refreshes the TTL
@Slf4j
public class ContextStore {

    private final StoreConnectionManager connections;
    private final KeyCodec keys;
    private final StatsSettings settings;

    public ContextStore(StoreConnectionManager connections, KeyCodec keys, StatsSettings settings) {
        this.connections = connections;
        this.keys = keys;
        this.settings = settings;
    }

    /**
     * Stores the payload if it is new and returns its id. Empty and null payloads carry no context
     * and return null.
     */
    public String put(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return null;
        }
        if (payload.length > settings.getMaxContextBytes()) {
            throw new InvalidContextException("Context of " + payload.length + " bytes exceeds the limit of "
                    + settings.getMaxContextBytes() + " bytes");
        }
        String contextId = contextId(payload);
        try (StoreLease lease = connections.acquire()) {
            boolean written = lease.writer().putIfAbsent(keys.contextKey(contextId), payload, settings.getContextTtl());
            log.debug("Context {} {}", contextId, written ? "stored" : "already present, TTL refreshed");
        }
        return contextId;
    }

    public String put(String payload) {
        return payload == null ? null : put(payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Batch lookup preserving request order. Ids with nothing stored map to an empty value.
     */
    public Map<String, Optional<byte[]>> get(Collection<String> contextIds) {
        Map<String, Optional<byte[]>> contexts = new LinkedHashMap<>();
        if (contextIds.isEmpty()) {
            return contexts;
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(contextIds));
        List<String> storeKeys = new ArrayList<>(ids.size());
        for (String id : ids) {
            storeKeys.add(keys.contextKey(id));
        }
        List<byte[]> payloads;
        try (StoreLease lease = connections.acquire()) {
            payloads = lease.reader().getAllBytes(storeKeys);
        }
        for (int i = 0; i < ids.size(); i++) {
            contexts.put(ids.get(i), Optional.ofNullable(payloads.get(i)));
        }
        return contexts;
    }

    public static String contextId(byte[] payload) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
