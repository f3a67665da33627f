package com.example.statstore.queryserver.model;

import com.example.statstore.common.types.Aggregate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Flat field map returned for one label
public final class StatSummary {

    public static final String COUNT = "count";
    public static final String AVG = "avg";
    public static final String STDEV = "stdev";
    public static final String MAX = "max";
    public static final String MIN = "min";
    public static final String TOTAL = "total";
    public static final String LAST = "last";
    public static final String LAST_TIME = "last_time";

    public static final List<String> FIELDS = List.of(COUNT, AVG, STDEV, MAX, MIN, TOTAL, LAST, LAST_TIME);

    private StatSummary() {
    }

    public static Map<String, Double> fields(Aggregate aggregate) {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put(COUNT, (double) aggregate.getCount());
        fields.put(AVG, aggregate.average().isPresent() ? aggregate.average().getAsDouble() : null);
        fields.put(STDEV, aggregate.stdev().isPresent() ? aggregate.stdev().getAsDouble() : null);
        fields.put(MAX, aggregate.getMax());
        fields.put(MIN, aggregate.getMin());
        fields.put(TOTAL, aggregate.getTotal());
        fields.put(LAST, aggregate.getLast());
        fields.put(LAST_TIME, aggregate.getLastTime());
        return fields;
    }
}
