package com.example.statstore.queryserver.prometheus;

import com.example.statstore.engine.reactive.ReactiveStatQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Streams the Prometheus text exposition of every label matching a glob, fetching aggregates in
 * batches as the label scan advances.
 */
@Slf4j
@Component
public class PrometheusExporter {

    static final int FETCH_BATCH = 100;

    private final ReactiveStatQueryService queries;
    private final FormatterRegistry formatters;

    public PrometheusExporter(ReactiveStatQueryService queries, FormatterRegistry formatters) {
        this.queries = queries;
        this.formatters = formatters;
    }

    public Flux<String> export(String matcher) {
        return queries.listLabels(matcher)
                .buffer(FETCH_BATCH)
                .concatMap(queries::fetchAggregates)
                .flatMapIterable(aggregates -> aggregates.entrySet())
                .filter(entry -> entry.getValue().isPresent())
                .concatMapIterable(entry -> formatters.resolve(entry.getKey())
                        .format(entry.getKey(), entry.getValue().get()))
                .map(line -> line + "\n")
                .doOnComplete(() -> log.debug("Prometheus export for '{}' complete", matcher));
    }
}
