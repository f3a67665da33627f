package com.example.statstore.common.types;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class AggregateTest {

    @Test
    void derivesAverageAndPopulationStdev() {
        Aggregate aggregate = Aggregate.builder()
                .label("latency").count(3).total(60.0).totalSquares(1400.0)
                .min(10.0).max(30.0).last(30.0).lastTime(1_700_000_000.0)
                .build();

        assertEquals(20.0, aggregate.average().getAsDouble(), 1e-9);
        assertEquals(8.1649658, aggregate.stdev().getAsDouble(), 1e-6);
    }

    @Test
    void emptyAggregateHasNoDerivedValues() {
        Aggregate aggregate = Aggregate.builder().label("nothing").build();

        assertFalse(aggregate.average().isPresent());
        assertFalse(aggregate.stdev().isPresent());
    }

    @Test
    void negativeVarianceFromRoundingIsClampedToZero() {
        double value = 0.1;
        Aggregate aggregate = Aggregate.builder()
                .label("constant").count(3).total(value * 3).totalSquares(value * value * 3 - 1e-18)
                .min(value).max(value).last(value)
                .build();

        assertEquals(0.0, aggregate.stdev().getAsDouble(), 1e-7);
    }
}
