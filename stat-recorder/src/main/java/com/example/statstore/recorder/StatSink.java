package com.example.statstore.recorder;

import com.example.statstore.common.types.Observation;
import com.example.statstore.engine.aggregate.StatAggregator;

@FunctionalInterface
public interface StatSink {

    void write(Observation observation);

    static StatSink of(StatAggregator aggregator) {
        return aggregator::record;
    }
}
