package com.example.statstore.recorder;

import com.example.statstore.common.types.Observation;
import com.example.statstore.engine.aggregate.ErrorLabels;
import com.example.statstore.engine.aggregate.LineLabels;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Buffers stats during a unit of work and writes them to a {@link StatSink} on {@link #close()}.
 * Each stat keeps the time it was buffered, not the time it was flushed.
 *
 * <pre>{@code
 * try (StatsBatch stats = new StatsBatch(StatSink.of(aggregator))) {
 *     for (Task task : tasks) {
 *         run(task);
 *         stats.stat(task.getName(), timer.lap().getLapSeconds());
 *     }
 * }
 * }</pre>
 *
 * <p>Not thread-safe; use one batch per unit of work.
 */
@Slf4j
public class StatsBatch implements AutoCloseable {

    private final StatSink sink;
    private final Clock clock;
    private final List<Observation> pending = new ArrayList<>();

    public StatsBatch(StatSink sink) {
        this(sink, Clock.systemUTC());
    }

    public StatsBatch(StatSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    public StatsBatch stat(String label, double value) {
        return stat(label, value, null, null);
    }

    public StatsBatch stat(String label, double value, String context) {
        return stat(label, value, context, null);
    }

    public StatsBatch stat(String label, double value, String context, Map<String, String> extraLabels) {
        pending.add(Observation.builder()
                .label(LineLabels.compose(label, extraLabels))
                .value(value)
                .timestamp(clock.instant())
                .context(context == null ? null : context.getBytes(StandardCharsets.UTF_8))
                .build());
        return this;
    }

    /**
     * Counts a failure under the error labels of its kind and of each additional name, with the
     * stack trace as context.
     */
    public StatsBatch exception(Throwable failure, String... additionalNames) {
        String[] names = new String[additionalNames.length + 1];
        names[0] = ErrorLabels.kindName(failure);
        System.arraycopy(additionalNames, 0, names, 1, additionalNames.length);
        return error(ErrorLabels.stackTrace(failure), names);
    }

    public StatsBatch error(String context, String... names) {
        for (String label : ErrorLabels.labels(names)) {
            stat(label, 1.0, context);
        }
        return this;
    }

    public List<Observation> pending() {
        return List.copyOf(pending);
    }

    /**
     * Writes every buffered stat. A sink failure propagates and leaves the unwritten stats buffered.
     */
    public void flush() {
        int written = 0;
        Iterator<Observation> it = pending.iterator();
        while (it.hasNext()) {
            sink.write(it.next());
            it.remove();
            written++;
        }
        log.debug("Flushed {} stats", written);
    }

    @Override
    public void close() {
        flush();
    }

    /**
     * Runs {@code body} with a fresh batch and flushes it on every exit path. A failure escaping the
     * body is counted as an error stat and rethrown unchanged; if the flush then fails as well, that
     * failure is attached to the original as suppressed.
     */
    public static <T, E extends Exception> T measure(StatSink sink, Clock clock, BatchBody<T, E> body) throws E {
        StatsBatch batch = new StatsBatch(sink, clock);
        T result;
        try {
            result = body.run(batch);
        } catch (RuntimeException | Error failure) {
            flushAfterFailure(batch, failure);
            throw failure;
        } catch (Exception failure) {
            flushAfterFailure(batch, failure);
            throw failure;
        }
        batch.flush();
        return result;
    }

    public static <T, E extends Exception> T measure(StatSink sink, BatchBody<T, E> body) throws E {
        return measure(sink, Clock.systemUTC(), body);
    }

    static void flushAfterFailure(StatsBatch batch, Throwable failure) {
        batch.exception(failure);
        try {
            batch.flush();
        } catch (RuntimeException flushFailure) {
            log.warn("Could not flush stats after failure {}", failure.toString(), flushFailure);
            failure.addSuppressed(flushFailure);
        }
    }

    @FunctionalInterface
    public interface BatchBody<T, E extends Exception> {
        T run(StatsBatch stats) throws E;
    }
}
