package com.example.statstore.engine.history;

import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.connection.StoreLease;
import com.example.statstore.engine.key.KeyCodec;
import com.example.statstore.engine.key.StatField;
import com.example.statstore.engine.store.StoreValues;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

// Newest-first lines of timestamp;value;contextId. The append itself travels inside the fold.
@Slf4j
public class HistoryLog {

    private static final String FIELD_SEPARATOR = ";";

    private final StoreConnectionManager connections;
    private final KeyCodec keys;
    private final StatsSettings settings;

    public HistoryLog(StoreConnectionManager connections, KeyCodec keys, StatsSettings settings) {
        this.connections = connections;
        this.keys = keys;
        this.settings = settings;
    }

    public String key(String label) {
        return keys.encode(label, StatField.HISTORY);
    }

    public int capacity() {
        return settings.getHistorySize();
    }

    public String encode(HistoryEntry entry) {
        return StoreValues.format(entry.getTimestamp()) + FIELD_SEPARATOR
                + StoreValues.format(entry.getValue()) + FIELD_SEPARATOR
                + (entry.getContextId() == null ? "" : entry.getContextId());
    }

    /**
     * Decodes a stored line, or returns null if it is not one this log wrote.
     */
    public HistoryEntry decode(String label, String line) {
        String[] parts = line.split(FIELD_SEPARATOR, -1);
        if (parts.length < 2) {
            return null;
        }
        Double timestamp = StoreValues.parse(parts[0]);
        Double value = StoreValues.parse(parts[1]);
        if (timestamp == null || value == null) {
            return null;
        }
        String contextId = parts.length > 2 && !parts[2].isEmpty() ? parts[2] : null;
        return HistoryEntry.builder()
                .timestamp(timestamp)
                .label(label)
                .value(value)
                .contextId(contextId)
                .build();
    }

    /**
     * Newest entries first. A null or non-positive limit reads the whole log.
     */
    public List<HistoryEntry> read(String label, Integer limit) {
        int size = limit == null || limit <= 0 ? capacity() : Math.min(limit, capacity());
        List<String> lines;
        try (StoreLease lease = connections.acquire()) {
            lines = lease.reader().range(key(label), 0, size - 1L);
        }
        List<HistoryEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            HistoryEntry entry = decode(label, line);
            if (entry == null) {
                log.warn("Skipping malformed history line for {}: {}", label, line);
                continue;
            }
            entries.add(entry);
        }
        return entries;
    }
}
