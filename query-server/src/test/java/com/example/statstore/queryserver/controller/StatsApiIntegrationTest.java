package com.example.statstore.queryserver.controller;

import com.example.statstore.engine.aggregate.StatAggregator;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.context.ContextStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {"stats.url=memory://query-server-test", "stats.namespace=TEST"})
@AutoConfigureWebTestClient
class StatsApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private StoreConnectionManager connections;

    @Autowired
    private StatsSettings settings;

    private StatAggregator aggregator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
        aggregator = new StatAggregator(connections, settings, clock);
    }

    @Test
    void servesAggregateOfRecordedLabel() {
        aggregator.record("latency", 10);
        aggregator.record("latency", 20);
        aggregator.record("latency", 30);

        webTestClient.get().uri("/api/v1/stats/latency")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(3.0)
                .jsonPath("$.avg").isEqualTo(20.0)
                .jsonPath("$.min").isEqualTo(10.0)
                .jsonPath("$.max").isEqualTo(30.0)
                .jsonPath("$.last_time").isEqualTo(1.7E9);
    }

    @Test
    void unknownLabelIsNotFound() {
        webTestClient.get().uri("/api/v1/stats/never-recorded")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void batchFetchReturnsEmptyObjectForMissingLabels() {
        aggregator.record("batch.a", 1);

        webTestClient.post().uri("/api/v1/stats")
                .bodyValue(List.of("batch.a", "batch.missing"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$['batch.a'].count").isEqualTo(1.0)
                .jsonPath("$['batch.missing']").isEmpty();
    }

    @Test
    void listsLabelsByMatcher() {
        aggregator.record("listing.one", 1);
        aggregator.record("listing.two", 1);
        aggregator.record("other", 1);

        webTestClient.get().uri("/api/v1/available-stats?matcher=listing.*")
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(String.class)
                .value(labels -> assertEquals(2, labels.size()))
                .contains("listing.one", "listing.two");
    }

    @Test
    void historyIsNewestFirstWithRenderedTime() {
        aggregator.record("hist", 1);
        aggregator.record("hist", 2);
        aggregator.record("hist", 3);

        webTestClient.get().uri("/api/v1/stats-history/hist?limit=2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].value").isEqualTo(3.0)
                .jsonPath("$[0].label").isEqualTo("hist")
                .jsonPath("$[0].time").isEqualTo("2023-11-14T22:13:20Z");
    }

    @Test
    void contextsAreReturnedAsText() {
        byte[] trace = "Traceback (most recent call last)".getBytes(StandardCharsets.UTF_8);
        aggregator.record("ctx.job", 1, trace);
        String id = ContextStore.contextId(trace);

        webTestClient.post().uri("/api/v1/stat-contexts")
                .bodyValue(List.of(id, "unknown"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(Map.class)
                .value(contexts -> {
                    assertEquals("Traceback (most recent call last)", contexts.get(id));
                    assertTrue(contexts.containsKey("unknown"));
                    assertEquals(null, contexts.get("unknown"));
                });
    }

    @Test
    void exportsPrometheusText() {
        aggregator.record("SNMP_WORKER", 2, null, Map.of("ip", "10.0.0.1"));
        aggregator.recordException(new IllegalStateException("boom"));

        webTestClient.get().uri("/api/v1/stats-prometheus?matcher=SNMP_WORKER*")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .value(body -> {
                    assertTrue(body.contains("SNMP_WORKER_COUNT{ip=\"10.0.0.1\"} 1.0\n"), body);
                    assertTrue(body.contains("SNMP_WORKER_LAST{ip=\"10.0.0.1\"} 2.0\n"), body);
                    assertTrue(!body.contains("LAST_TIME"), body);
                });

        webTestClient.get().uri("/api/v1/stats-prometheus?matcher=errors__*")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .value(body -> {
                    assertTrue(body.contains("TEST_ERROR_COUNT{EXC=\"IllegalStateException\"} 1.0\n"), body);
                    assertTrue(body.contains("TEST_ERROR_COUNT{error=\"all\"} 1.0\n"), body);
                });
    }
}
