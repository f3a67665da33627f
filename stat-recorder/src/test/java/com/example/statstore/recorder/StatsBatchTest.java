package com.example.statstore.recorder;

import com.example.statstore.common.types.Observation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatsBatchTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
    private final CapturingStatSink sink = new CapturingStatSink();

    @Test
    void flushesOnCloseAndClearsTheBuffer() {
        StatsBatch batch = new StatsBatch(sink, clock);
        try (batch) {
            batch.stat("jobs", 1).stat("jobs", 2, "ctx");
            assertEquals(0, sink.size());
        }

        assertEquals(List.of("jobs", "jobs"), sink.labels());
        assertTrue(batch.pending().isEmpty());
        Observation second = sink.observations().get(1);
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), second.getTimestamp());
        assertArrayEquals("ctx".getBytes(StandardCharsets.UTF_8), second.getContext());

        batch.close();
        assertEquals(2, sink.size());
    }

    @Test
    void extraLabelsBecomeLineProtocolLabel() {
        try (StatsBatch batch = new StatsBatch(sink, clock)) {
            batch.stat("SNMP_WORKER", 0.5, null, Map.of("ip", "10.0.0.1"));
        }

        assertEquals(List.of("SNMP_WORKER;ip=10.0.0.1"), sink.labels());
    }

    @Test
    void errorCountsEachLabelOnce() {
        try (StatsBatch batch = new StatsBatch(sink, clock)) {
            batch.error("details", "db", "all", "db");
        }

        assertEquals(List.of("errors__db", "errors__all"), sink.labels());
    }

    @Test
    void measureRecordsEscapingFailureAndRethrowsIt() {
        IOException failure = new IOException("disk gone");

        IOException thrown = assertThrows(IOException.class, () -> StatsBatch.measure(sink, clock, stats -> {
            stats.stat("before", 1);
            throw failure;
        }));

        assertSame(failure, thrown);
        assertEquals(List.of("before", "errors__EXC:IOException", "errors__all"), sink.labels());
        String context = new String(sink.observations("errors__all").get(0).getContext(), StandardCharsets.UTF_8);
        assertTrue(context.contains("disk gone"));
    }

    @Test
    void measureReturnsBodyResultAfterFlushing() {
        String result = StatsBatch.measure(sink, clock, stats -> {
            stats.stat("ok", 1);
            return "done";
        });

        assertEquals("done", result);
        assertEquals(List.of("ok"), sink.labels());
    }

    @Test
    void flushFailureIsSuppressedUnderTheOriginal() {
        IllegalStateException storeDown = new IllegalStateException("store down");
        StatSink failing = observation -> {
            throw storeDown;
        };
        RuntimeException original = new RuntimeException("body failed");

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> StatsBatch.measure(failing, clock, stats -> {
            throw original;
        }));

        assertSame(original, thrown);
        assertSame(storeDown, thrown.getSuppressed()[0]);
    }

    @Test
    void sinkFailureKeepsUnwrittenStats() {
        StatsBatch batch = new StatsBatch(observation -> {
            if (observation.getLabel().equals("b")) {
                throw new IllegalStateException("rejected");
            }
        }, clock);
        batch.stat("a", 1).stat("b", 2).stat("c", 3);

        assertThrows(IllegalStateException.class, batch::flush);
        assertEquals(List.of("b", "c"), batch.pending().stream().map(Observation::getLabel).toList());
    }
}
