package com.example.statstore.engine.key;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

// Field segment of a store key: NS::<FIELD>::label
public enum StatField {
    LAST,
    LAST_TIME,
    MIN,
    MAX,
    AVG,
    STDEV,
    COUNT,
    TOTAL,
    TOTAL_SQ,
    HISTORY,
    CONTEXTS;

    // Fields physically written by a fold; AVG and STDEV are derived on read
    public static final Set<StatField> STORED = EnumSet.of(COUNT, TOTAL, TOTAL_SQ, MIN, MAX, LAST, LAST_TIME);

    public static Optional<StatField> fromSegment(String segment) {
        for (StatField field : values()) {
            if (field.name().equals(segment)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
