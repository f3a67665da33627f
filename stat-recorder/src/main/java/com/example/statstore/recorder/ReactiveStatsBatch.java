package com.example.statstore.recorder;

import com.example.statstore.engine.aggregate.StatAggregator;
import com.example.statstore.engine.reactive.ReactiveStatAggregator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.function.Function;

// StatsBatch.measure for Reactor pipelines, flushed on completion, error or cancel
@Slf4j
public final class ReactiveStatsBatch {

    private ReactiveStatsBatch() {
    }

    public static <T> Mono<T> measure(ReactiveStatAggregator aggregator, Function<StatsBatch, Mono<T>> body) {
        StatAggregator blocking = aggregator.blocking();
        return measure(StatSink.of(blocking), blocking.getClock(), aggregator.getScheduler(), body);
    }

    public static <T> Mono<T> measure(StatSink sink, Clock clock, Scheduler scheduler, Function<StatsBatch, Mono<T>> body) {
        return Mono.usingWhen(
                Mono.fromSupplier(() -> new StatsBatch(sink, clock)),
                body,
                batch -> flush(batch, scheduler),
                (batch, failure) -> Mono.fromRunnable(() -> StatsBatch.flushAfterFailure(batch, failure))
                        .subscribeOn(scheduler),
                batch -> flush(batch, scheduler));
    }

    private static Mono<Void> flush(StatsBatch batch, Scheduler scheduler) {
        return Mono.<Void>fromRunnable(batch::flush).subscribeOn(scheduler);
    }
}
