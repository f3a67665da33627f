package com.example.statstore.engine.reactive;

import com.example.statstore.common.types.Observation;
import com.example.statstore.engine.aggregate.StatAggregator;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;

// Runs the blocking aggregator on a scheduler for blocking work
public class ReactiveStatAggregator {

    private final StatAggregator aggregator;
    private final Scheduler scheduler;

    public ReactiveStatAggregator(StatAggregator aggregator) {
        this(aggregator, Schedulers.boundedElastic());
    }

    public ReactiveStatAggregator(StatAggregator aggregator, Scheduler scheduler) {
        this.aggregator = aggregator;
        this.scheduler = scheduler;
    }

    public Mono<Void> record(Observation observation) {
        return Mono.<Void>fromRunnable(() -> aggregator.record(observation)).subscribeOn(scheduler);
    }

    public Mono<Void> record(String label, double value) {
        return record(Observation.of(label, value));
    }

    public Mono<Void> recordAcross(Collection<String> labels, double value, byte[] context) {
        return Mono.<Void>fromRunnable(() -> aggregator.recordAcross(labels, value, context)).subscribeOn(scheduler);
    }

    public Mono<Void> recordException(Throwable failure, String... additionalNames) {
        return Mono.<Void>fromRunnable(() -> aggregator.recordException(failure, additionalNames)).subscribeOn(scheduler);
    }

    public StatAggregator blocking() {
        return aggregator;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }
}
