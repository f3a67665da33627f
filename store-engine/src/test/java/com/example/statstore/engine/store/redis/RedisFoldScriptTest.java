package com.example.statstore.engine.store.redis;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.common.types.HistoryEntry;
import com.example.statstore.engine.aggregate.StatAggregator;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.error.AggregateOverflowException;
import com.example.statstore.engine.key.KeyCodec;
import com.example.statstore.engine.key.StatField;
import com.example.statstore.engine.query.StatQueryService;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

// Runs the fold script against a real Redis; skipped where Docker is missing
@Testcontainers(disabledWithoutDocker = true)
class RedisFoldScriptTest {

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

    private RedisClient client;
    private StatefulRedisConnection<String, String> raw;
    private RedisCommands<String, String> commands;

    private StatsSettings settings;
    private StoreConnectionManager connections;
    private StatAggregator aggregator;
    private StatQueryService queries;
    private KeyCodec keys;

    @BeforeEach
    void setUp() {
        String url = "redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379);
        client = RedisClient.create(url);
        raw = client.connect();
        commands = raw.sync();
        commands.flushall();

        settings = StatsSettings.defaults();
        settings.setUrl(url);
        settings.setHistorySize(3);
        settings.setTtl(Duration.ofMinutes(10));
        connections = new StoreConnectionManager(settings);
        connections.openConnection();

        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        aggregator = new StatAggregator(connections, settings, clock);
        queries = new StatQueryService(connections, settings);
        keys = new KeyCodec(settings.getNamespace());
    }

    @AfterEach
    void tearDown() {
        connections.close();
        raw.close();
        client.shutdown();
    }

    @Test
    void foldsLatencyScenario() {
        aggregator.record("latency", 10.0);
        aggregator.record("latency", 20.0);
        aggregator.record("latency", 30.0);

        Aggregate aggregate = queries.fetchAggregate("latency").orElseThrow();
        assertEquals(3, aggregate.getCount());
        assertEquals(60.0, aggregate.getTotal(), 1e-9);
        assertEquals(20.0, aggregate.average().getAsDouble(), 1e-9);
        assertEquals(8.1649658, aggregate.stdev().getAsDouble(), 1e-6);
        assertEquals(10.0, aggregate.getMin(), 1e-9);
        assertEquals(30.0, aggregate.getMax(), 1e-9);
        assertEquals(30.0, aggregate.getLast(), 1e-9);
    }

    @Test
    void historyIsCappedNewestFirst() {
        for (int i = 1; i <= 5; i++) {
            aggregator.record("jobs", i);
        }

        List<Double> values = queries.fetchHistory("jobs", null).stream()
                .map(HistoryEntry::getValue)
                .collect(Collectors.toList());
        assertEquals(List.of(5.0, 4.0, 3.0), values);
        assertEquals(3L, commands.llen(keys.encode("jobs", StatField.HISTORY)));
    }

    @Test
    void foldSetsTtlOnEveryKey() {
        aggregator.record("ttl", 1.0);

        for (StatField field : List.of(StatField.COUNT, StatField.TOTAL, StatField.TOTAL_SQ, StatField.MIN,
                StatField.MAX, StatField.LAST, StatField.LAST_TIME, StatField.HISTORY)) {
            long ttl = commands.ttl(keys.encode("ttl", field));
            assertTrue(ttl > 0 && ttl <= 600, field + " has ttl " + ttl);
        }
    }

    @Test
    void overflowingFoldWritesNothing() {
        aggregator.record("big", 1e154);

        assertThrows(AggregateOverflowException.class, () -> aggregator.record("big", 1e154));

        Aggregate aggregate = queries.fetchAggregate("big").orElseThrow();
        assertEquals(1, aggregate.getCount());
        assertEquals(1e154, aggregate.getTotal());
        assertEquals(1, queries.fetchHistory("big", null).size());
    }

    @Test
    void lostCountReseedsTheSums() {
        aggregator.record("partial", 100.0);
        aggregator.record("partial", 200.0);
        commands.del(keys.encode("partial", StatField.COUNT));

        aggregator.record("partial", 7.0);

        Aggregate aggregate = queries.fetchAggregate("partial").orElseThrow();
        assertEquals(1, aggregate.getCount());
        assertEquals(7.0, aggregate.getTotal(), 1e-9);
        assertEquals(7.0, aggregate.getMin(), 1e-9);
        assertEquals(7.0, aggregate.getMax(), 1e-9);
        assertEquals(0.0, aggregate.stdev().getAsDouble(), 1e-9);
    }
}
