package com.example.statstore.engine.aggregate;

import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.common.types.Observation;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.connection.StoreLease;
import com.example.statstore.engine.context.ContextStore;
import com.example.statstore.engine.history.HistoryLog;
import com.example.statstore.engine.key.KeyCodec;
import com.example.statstore.engine.key.StatField;
import com.example.statstore.engine.store.FoldCommand;
import com.example.statstore.engine.store.StoreValues;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;

// One atomic store-side fold per label and observation. A StoreTimeoutException leaves the fold outcome unknown.
@Slf4j
public class StatAggregator {

    private final StoreConnectionManager connections;
    private final KeyCodec keys;
    private final ContextStore contexts;
    private final HistoryLog history;
    private final StatsSettings settings;
    private final Clock clock;

    public StatAggregator(StoreConnectionManager connections, StatsSettings settings) {
        this(connections, settings, Clock.systemUTC());
    }

    public StatAggregator(StoreConnectionManager connections, StatsSettings settings, Clock clock) {
        this(connections, new KeyCodec(settings.getNamespace()), settings, clock);
    }

    private StatAggregator(StoreConnectionManager connections, KeyCodec keys, StatsSettings settings, Clock clock) {
        this(connections, keys, new ContextStore(connections, keys, settings), new HistoryLog(connections, keys, settings),
                settings, clock);
    }

    public StatAggregator(StoreConnectionManager connections, KeyCodec keys, ContextStore contexts, HistoryLog history,
                          StatsSettings settings, Clock clock) {
        this.connections = connections;
        this.keys = keys;
        this.contexts = contexts;
        this.history = history;
        this.settings = settings;
        this.clock = clock;
    }

    public void record(String label, double value) {
        record(Observation.of(label, value));
    }

    public void record(String label, double value, byte[] context) {
        record(Observation.builder().label(label).value(value).context(context).build());
    }

    public void record(String label, double value, String context, Map<String, String> extraLabels) {
        record(Observation.of(LineLabels.compose(label, extraLabels), value, context));
    }

    public void record(Observation observation) {
        String label = observation.getLabel();
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Stat label must not be blank");
        }
        if (!Double.isFinite(observation.getValue())) {
            throw new IllegalArgumentException("Stat value for " + label + " must be finite, got " + observation.getValue());
        }
        if (!Double.isFinite(observation.getValue() * observation.getValue())) {
            throw new IllegalArgumentException("Stat value for " + label + " is too large, its square overflows: "
                    + observation.getValue());
        }
        Instant at = observation.getTimestamp() != null ? observation.getTimestamp() : clock.instant();
        double timestamp = at.toEpochMilli() / 1000.0;

        try (StoreLease lease = connections.acquire()) {
            String contextId = contexts.put(observation.getContext());
            HistoryEntry entry = HistoryEntry.builder()
                    .timestamp(timestamp)
                    .label(label)
                    .value(observation.getValue())
                    .contextId(contextId)
                    .build();
            FoldCommand command = FoldCommand.builder()
                    .countKey(keys.encode(label, StatField.COUNT))
                    .totalKey(keys.encode(label, StatField.TOTAL))
                    .totalSquaresKey(keys.encode(label, StatField.TOTAL_SQ))
                    .minKey(keys.encode(label, StatField.MIN))
                    .maxKey(keys.encode(label, StatField.MAX))
                    .lastKey(keys.encode(label, StatField.LAST))
                    .lastTimeKey(keys.encode(label, StatField.LAST_TIME))
                    .historyKey(history.key(label))
                    .value(observation.getValue())
                    .timestamp(StoreValues.format(timestamp))
                    .historyEntry(history.encode(entry))
                    .historySize(history.capacity())
                    .ttl(settings.getTtl())
                    .build();
            long count = lease.writer().fold(command);
            log.debug("Recorded {} = {} (count {})", label, observation.getValue(), count);
        }
    }

    /**
     * Records the same value under each label independently. A failure stops at the failing label;
     * labels recorded before it stay recorded.
     */
    public void recordAcross(Collection<String> labels, double value, byte[] context) {
        Instant at = clock.instant();
        for (String label : new LinkedHashSet<>(labels)) {
            record(Observation.builder().label(label).value(value).timestamp(at).context(context).build());
        }
    }

    /**
     * Counts a failure under {@code errors__all}, {@code errors__EXC:<kind>} and
     * {@code errors__<name>} for each additional name, with the stack trace as context.
     */
    public void recordException(Throwable failure, String... additionalNames) {
        String context = ErrorLabels.stackTrace(failure);
        recordAcross(ErrorLabels.labels(failure, additionalNames), 1.0, context.getBytes(StandardCharsets.UTF_8));
    }

    public void error(String context, String... names) {
        recordAcross(ErrorLabels.labels(names), 1.0, context == null ? null : context.getBytes(StandardCharsets.UTF_8));
    }

    public KeyCodec getKeys() {
        return keys;
    }

    public Clock getClock() {
        return clock;
    }
}
