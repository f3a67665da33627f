package com.example.statstore.recorder;

import com.example.statstore.common.types.Observation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

// Keeps observations in memory, for tests of code that records stats
public class CapturingStatSink implements StatSink {

    private final List<Observation> observations = new ArrayList<>();

    @Override
    public synchronized void write(Observation observation) {
        observations.add(observation);
    }

    public synchronized List<Observation> observations() {
        return List.copyOf(observations);
    }

    public synchronized List<Observation> observations(String label) {
        return observations.stream()
                .filter(observation -> label.equals(observation.getLabel()))
                .collect(Collectors.toList());
    }

    public synchronized List<String> labels() {
        return observations.stream().map(Observation::getLabel).collect(Collectors.toList());
    }

    public synchronized int size() {
        return observations.size();
    }

    public synchronized void clear() {
        observations.clear();
    }
}
