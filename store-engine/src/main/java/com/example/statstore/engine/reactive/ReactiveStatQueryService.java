package com.example.statstore.engine.reactive;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.engine.query.StatQueryService;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReactiveStatQueryService {

    private final StatQueryService queries;
    private final Scheduler scheduler;

    public ReactiveStatQueryService(StatQueryService queries) {
        this(queries, Schedulers.boundedElastic());
    }

    public ReactiveStatQueryService(StatQueryService queries, Scheduler scheduler) {
        this.queries = queries;
        this.scheduler = scheduler;
    }

    // The scan stream is closed on completion, error and cancellation
    public Flux<String> listLabels(String labelGlob) {
        return Flux.fromStream(() -> queries.listLabels(labelGlob)).subscribeOn(scheduler);
    }

    public Mono<Optional<Aggregate>> fetchAggregate(String label) {
        return Mono.fromCallable(() -> queries.fetchAggregate(label)).subscribeOn(scheduler);
    }

    public Mono<Map<String, Optional<Aggregate>>> fetchAggregates(Collection<String> labels) {
        return Mono.fromCallable(() -> queries.fetchAggregates(labels)).subscribeOn(scheduler);
    }

    public Mono<List<HistoryEntry>> fetchHistory(String label, Integer limit) {
        return Mono.fromCallable(() -> queries.fetchHistory(label, limit)).subscribeOn(scheduler);
    }

    public Mono<Map<String, Optional<byte[]>>> fetchContexts(Collection<String> contextIds) {
        return Mono.fromCallable(() -> queries.fetchContexts(contextIds)).subscribeOn(scheduler);
    }
}
