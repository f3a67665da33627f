package com.example.statstore.engine.store.memory;

import com.example.statstore.engine.error.AggregateOverflowException;
import com.example.statstore.engine.error.StatStoreException;
import com.example.statstore.engine.store.FoldCommand;
import com.example.statstore.engine.store.StatStore;
import com.example.statstore.engine.store.StoreValues;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local {@link StatStore} with Redis semantics for the subset the engine uses, including
 * per-key expiry against an injectable {@link Clock}. Every operation holds the store monitor, which
 * makes each fold atomic with respect to all other operations.
 */
public class InMemoryStatStore implements StatStore {

    private final Map<String, Slot> slots = new HashMap<>();
    private final Clock clock;

    public InMemoryStatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStatStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long fold(FoldCommand command) {
        double value = command.getValue();
        String formatted = StoreValues.format(value);

        // Every new value is computed and checked before the first write
        long count = parseLong(readString(command.getCountKey())) + 1;
        double total = count == 1 ? value : readFloat(command.getTotalKey()) + value;
        double totalSquares = count == 1 ? value * value : readFloat(command.getTotalSquaresKey()) + value * value;
        if (!Double.isFinite(total) || !Double.isFinite(totalSquares)) {
            throw new AggregateOverflowException(AggregateOverflowException.MARKER + " sums of "
                    + command.getCountKey() + " would overflow");
        }
        Double min = StoreValues.parse(readString(command.getMinKey()));
        Double max = StoreValues.parse(readString(command.getMaxKey()));
        String newTotal = count == 1 ? formatted : StoreValues.format(total);
        String newTotalSquares = StoreValues.format(totalSquares);

        writeString(command.getCountKey(), String.valueOf(count));
        writeString(command.getTotalKey(), newTotal);
        writeString(command.getTotalSquaresKey(), newTotalSquares);
        if (count == 1 || min == null || value < min) {
            writeString(command.getMinKey(), formatted);
        }
        if (count == 1 || max == null || value > max) {
            writeString(command.getMaxKey(), formatted);
        }
        writeString(command.getLastKey(), formatted);
        writeString(command.getLastTimeKey(), command.getTimestamp());

        LinkedList<String> history = readList(command.getHistoryKey());
        history.addFirst(command.getHistoryEntry());
        while (history.size() > command.getHistorySize()) {
            history.removeLast();
        }

        Instant expiresAt = clock.instant().plus(command.getTtl());
        for (String key : command.keys()) {
            Slot slot = live(key);
            if (slot != null) {
                slot.expiresAt = expiresAt;
            }
        }
        return count;
    }

    @Override
    public synchronized boolean putIfAbsent(String key, byte[] payload, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        Slot existing = live(key);
        if (existing != null) {
            existing.expiresAt = expiresAt;
            return false;
        }
        slots.put(key, new Slot(payload.clone(), expiresAt));
        return true;
    }

    @Override
    public synchronized List<String> getAll(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(readString(key));
        }
        return values;
    }

    @Override
    public synchronized List<byte[]> getAllBytes(List<String> keys) {
        List<byte[]> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            Slot slot = live(key);
            if (slot == null) {
                values.add(null);
            } else if (slot.value instanceof byte[]) {
                values.add(((byte[]) slot.value).clone());
            } else if (slot.value instanceof String) {
                values.add(((String) slot.value).getBytes(StandardCharsets.UTF_8));
            } else {
                throw wrongType(key);
            }
        }
        return values;
    }

    @Override
    public synchronized List<String> range(String key, long start, long stop) {
        Slot slot = live(key);
        if (slot == null) {
            return Collections.emptyList();
        }
        if (!(slot.value instanceof LinkedList)) {
            throw wrongType(key);
        }
        @SuppressWarnings("unchecked")
        List<String> list = (List<String>) slot.value;
        int size = list.size();
        long from = start < 0 ? Math.max(0, size + start) : start;
        long to = stop < 0 ? size + stop : Math.min(stop, size - 1L);
        if (from > to || from >= size) {
            return Collections.emptyList();
        }
        return new ArrayList<>(list.subList((int) from, (int) to + 1));
    }

    @Override
    public synchronized Stream<String> scan(String pattern, int batchSize) {
        Pattern regex = GlobPattern.compile(pattern);
        List<String> matches = slots.keySet().stream()
                .filter(key -> live(key) != null)
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toList());
        return matches.stream();
    }

    // Remaining time to live of a key, empty when the key is absent or expired
    public synchronized Optional<Duration> timeToLive(String key) {
        Slot slot = live(key);
        if (slot == null || slot.expiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), slot.expiresAt));
    }

    public synchronized int size() {
        slots.keySet().removeIf(key -> isExpired(slots.get(key)));
        return slots.size();
    }

    private Slot live(String key) {
        Slot slot = slots.get(key);
        if (slot != null && isExpired(slot)) {
            slots.remove(key);
            return null;
        }
        return slot;
    }

    private boolean isExpired(Slot slot) {
        return slot.expiresAt != null && !clock.instant().isBefore(slot.expiresAt);
    }

    private String readString(String key) {
        Slot slot = live(key);
        if (slot == null) {
            return null;
        }
        if (slot.value instanceof String) {
            return (String) slot.value;
        }
        if (slot.value instanceof byte[]) {
            return new String((byte[]) slot.value, StandardCharsets.UTF_8);
        }
        throw wrongType(key);
    }

    // SET semantics: replaces the value and clears any expiry
    private void writeString(String key, String value) {
        slots.put(key, new Slot(value, null));
    }

    // Missing counts as zero, like INCRBYFLOAT
    private double readFloat(String key) {
        String raw = readString(key);
        if (raw == null) {
            return 0.0;
        }
        Double parsed = StoreValues.parse(raw);
        if (parsed == null) {
            throw new StatStoreException("Value at " + key + " is not a float");
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private LinkedList<String> readList(String key) {
        Slot slot = live(key);
        if (slot == null) {
            LinkedList<String> list = new LinkedList<>();
            slots.put(key, new Slot(list, null));
            return list;
        }
        if (!(slot.value instanceof LinkedList)) {
            throw wrongType(key);
        }
        return (LinkedList<String>) slot.value;
    }

    private static long parseLong(String raw) {
        if (raw == null) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new StatStoreException("Value is not an integer: " + raw, e);
        }
    }

    private static StatStoreException wrongType(String key) {
        return new StatStoreException("WRONGTYPE operation against key " + key);
    }

    private static final class Slot {
        private Object value;
        private Instant expiresAt;

        private Slot(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
