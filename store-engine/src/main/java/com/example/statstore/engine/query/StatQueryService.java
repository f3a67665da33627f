package com.example.statstore.engine.query;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.connection.StoreLease;
import com.example.statstore.engine.context.ContextStore;
import com.example.statstore.engine.history.HistoryLog;
import com.example.statstore.engine.key.DecodedKey;
import com.example.statstore.engine.key.KeyCodec;
import com.example.statstore.engine.key.StatField;
import com.example.statstore.engine.store.StoreValues;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

// Read side; never writes or refreshes a TTL
@Slf4j
public class StatQueryService {

    // MGET order of the stored aggregate fields
    private static final List<StatField> AGGREGATE_FIELDS = List.of(
            StatField.COUNT, StatField.TOTAL, StatField.TOTAL_SQ, StatField.MIN, StatField.MAX,
            StatField.LAST, StatField.LAST_TIME);

    private final StoreConnectionManager connections;
    private final KeyCodec keys;
    private final HistoryLog history;
    private final ContextStore contexts;
    private final StatsSettings settings;

    public StatQueryService(StoreConnectionManager connections, StatsSettings settings) {
        this(connections, new KeyCodec(settings.getNamespace()), settings);
    }

    private StatQueryService(StoreConnectionManager connections, KeyCodec keys, StatsSettings settings) {
        this(connections, keys, new HistoryLog(connections, keys, settings), new ContextStore(connections, keys, settings),
                settings);
    }

    public StatQueryService(StoreConnectionManager connections, KeyCodec keys, HistoryLog history, ContextStore contexts,
                            StatsSettings settings) {
        this.connections = connections;
        this.keys = keys;
        this.history = history;
        this.contexts = contexts;
        this.settings = settings;
    }

    /**
     * Lazily scans for labels matching a glob. The stream holds a connection reference until it is
     * closed, so use it in a try-with-resources block.
     */
    public Stream<String> listLabels(String labelGlob) {
        StoreLease lease = connections.acquire();
        try {
            return lease.reader().scan(keys.labelPattern(labelGlob), settings.getScanBatchSize())
                    .map(keys::tryDecode)
                    .flatMap(Optional::stream)
                    .filter(decoded -> decoded.getField() == StatField.COUNT)
                    .map(DecodedKey::getLabel)
                    .distinct()
                    .onClose(lease::close);
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
    }

    public Optional<Aggregate> fetchAggregate(String label) {
        return fetchAggregates(List.of(label)).get(label);
    }

    /**
     * One round trip for all labels. Every requested label is present in the result, mapped to
     * empty when it has no data.
     */
    public Map<String, Optional<Aggregate>> fetchAggregates(Collection<String> labels) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(labels));
        List<String> storeKeys = new ArrayList<>(unique.size() * AGGREGATE_FIELDS.size());
        for (String label : unique) {
            for (StatField field : AGGREGATE_FIELDS) {
                storeKeys.add(keys.encode(label, field));
            }
        }
        List<String> values;
        try (StoreLease lease = connections.acquire()) {
            values = lease.reader().getAll(storeKeys);
        }
        Map<String, Optional<Aggregate>> aggregates = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            int offset = i * AGGREGATE_FIELDS.size();
            aggregates.put(unique.get(i), toAggregate(unique.get(i), values.subList(offset, offset + AGGREGATE_FIELDS.size())));
        }
        return aggregates;
    }

    public List<HistoryEntry> fetchHistory(String label, Integer limit) {
        return history.read(label, limit);
    }

    public Map<String, Optional<byte[]>> fetchContexts(Collection<String> contextIds) {
        return contexts.get(contextIds);
    }

    private Optional<Aggregate> toAggregate(String label, List<String> raw) {
        Double count = StoreValues.parse(raw.get(0));
        if (count == null || count <= 0) {
            return Optional.empty();
        }
        Double total = StoreValues.parse(raw.get(1));
        Double totalSquares = StoreValues.parse(raw.get(2));
        Double min = StoreValues.parse(raw.get(3));
        Double max = StoreValues.parse(raw.get(4));
        Double last = StoreValues.parse(raw.get(5));
        Double lastTime = StoreValues.parse(raw.get(6));
        if (total == null || totalSquares == null || min == null || max == null || last == null || lastTime == null) {
            log.debug("Aggregate of {} is incomplete, treating as expired", label);
            return Optional.empty();
        }
        return Optional.of(Aggregate.builder()
                .label(label)
                .count(count.longValue())
                .total(total)
                .totalSquares(totalSquares)
                .min(min)
                .max(max)
                .last(last)
                .lastTime(lastTime)
                .build());
    }
}
