package com.example.statstore.queryserver.controller;

import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.error.InvalidContextException;
import com.example.statstore.engine.error.NotConnectedException;
import com.example.statstore.engine.error.StoreTimeoutException;
import com.example.statstore.engine.error.StoreUnavailableException;
import com.example.statstore.engine.reactive.ReactiveStatQueryService;
import com.example.statstore.queryserver.model.HistoryRecord;
import com.example.statstore.queryserver.model.StatSummary;
import com.example.statstore.queryserver.prometheus.PrometheusExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/v1")
public class StatsController {

    private final ReactiveStatQueryService queries;
    private final PrometheusExporter exporter;
    private final StatsSettings settings;

    public StatsController(ReactiveStatQueryService queries, PrometheusExporter exporter, StatsSettings settings) {
        this.queries = queries;
        this.exporter = exporter;
        this.settings = settings;
    }

    @GetMapping("/available-stats")
    public Mono<List<String>> availableStats(@RequestParam(defaultValue = "*") String matcher) {
        return queries.listLabels(matcher)
                .collectList()
                .onErrorMap(StatsController::toHttpError);
    }

    @GetMapping("/stats/{label}")
    public Mono<ResponseEntity<Map<String, Double>>> stats(@PathVariable String label) {
        return queries.fetchAggregate(label)
                .map(aggregate -> aggregate
                        .map(StatSummary::fields)
                        .map(ResponseEntity::ok)
                        .orElse(ResponseEntity.notFound().build()))
                .onErrorMap(StatsController::toHttpError);
    }

    // Labels without data map to an empty object
    @PostMapping("/stats")
    public Mono<Map<String, Map<String, Double>>> batchStats(@RequestBody List<String> labels) {
        return queries.fetchAggregates(labels)
                .map(aggregates -> {
                    Map<String, Map<String, Double>> result = new LinkedHashMap<>();
                    aggregates.forEach((label, aggregate) -> result.put(label,
                            aggregate.map(StatSummary::fields).orElse(Collections.emptyMap())));
                    return result;
                })
                .onErrorMap(StatsController::toHttpError);
    }

    @GetMapping("/stats-history/{label}")
    public Mono<List<HistoryRecord>> history(@PathVariable String label,
                                             @RequestParam(required = false) Integer limit) {
        return queries.fetchHistory(label, limit)
                .map(entries -> entries.stream().map(this::toRecord).collect(Collectors.toList()))
                .onErrorMap(StatsController::toHttpError);
    }

    // Contexts are returned as UTF-8 text, null for ids with nothing stored
    @PostMapping("/stat-contexts")
    public Mono<Map<String, String>> contexts(@RequestBody List<String> contextIds) {
        return queries.fetchContexts(contextIds)
                .map(contexts -> {
                    Map<String, String> result = new LinkedHashMap<>();
                    contexts.forEach((id, payload) -> result.put(id,
                            payload.map(bytes -> new String(bytes, StandardCharsets.UTF_8)).orElse(null)));
                    return result;
                })
                .onErrorMap(StatsController::toHttpError);
    }

    @GetMapping(value = "/stats-prometheus", produces = MediaType.TEXT_PLAIN_VALUE)
    public Flux<String> prometheus(@RequestParam(defaultValue = "*") String matcher) {
        return exporter.export(matcher)
                .onErrorMap(StatsController::toHttpError);
    }

    private HistoryRecord toRecord(HistoryEntry entry) {
        Instant at = Instant.ofEpochMilli(Math.round(entry.getTimestamp() * 1000));
        return HistoryRecord.builder()
                .timestamp(entry.getTimestamp())
                .time(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(at.atZone(settings.zoneId())))
                .label(entry.getLabel())
                .value(entry.getValue())
                .contextId(entry.getContextId())
                .build();
    }

    static Throwable toHttpError(Throwable error) {
        if (error instanceof StoreTimeoutException) {
            log.warn("Store timed out: {}", error.getMessage());
            return new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT, error.getMessage(), error);
        }
        if (error instanceof StoreUnavailableException || error instanceof NotConnectedException) {
            log.warn("Store unavailable: {}", error.getMessage());
            return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, error.getMessage(), error);
        }
        if (error instanceof InvalidContextException || error instanceof IllegalArgumentException) {
            return new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage(), error);
        }
        return error;
    }
}
