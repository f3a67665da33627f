package com.example.statstore.common.types;

import lombok.Builder;
import lombok.Data;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

// A single measurement submitted by a producer
@Data
@Builder
public class Observation {
    private String label;
    private double value;
    private Instant timestamp; // Null means "now" for the recording engine
    private byte[] context;    // Optional diagnostic payload, e.g. a stack trace

    public static Observation of(String label, double value) {
        return Observation.builder().label(label).value(value).build();
    }

    public static Observation of(String label, double value, String context) {
        return Observation.builder()
                .label(label)
                .value(value)
                .context(context == null ? null : context.getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
