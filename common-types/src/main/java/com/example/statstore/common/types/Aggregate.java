package com.example.statstore.common.types;

import lombok.Builder;
import lombok.Data;

import java.util.OptionalDouble;

// Running aggregate of one label, as stored by the engine
@Data
@Builder
public class Aggregate {
    private String label;
    private long count;
    private double total;
    private double totalSquares; // For standard deviation
    private double min;
    private double max;
    private double last;
    private double lastTime;     // Unix seconds of the most recent observation

    public OptionalDouble average() {
        if (count <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(total / count);
    }

    /**
     * Population standard deviation. Cancellation can push the variance slightly below zero,
     * so it is clamped before the square root.
     */
    public OptionalDouble stdev() {
        if (count <= 0) {
            return OptionalDouble.empty();
        }
        double average = total / count;
        double variance = totalSquares / count - average * average;
        return OptionalDouble.of(Math.sqrt(Math.max(0.0, variance)));
    }
}
