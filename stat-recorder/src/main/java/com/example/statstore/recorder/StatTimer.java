package com.example.statstore.recorder;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

// Each lap() returns the seconds since the previous lap and the running total
public class StatTimer {

    private final Clock clock;
    private Instant lastLap;
    private double totalSeconds;

    public StatTimer() {
        this(Clock.systemUTC());
    }

    public StatTimer(Clock clock) {
        this.clock = clock;
        this.lastLap = clock.instant();
    }

    public synchronized Lap lap() {
        Instant now = clock.instant();
        double lapSeconds = Duration.between(lastLap, now).toNanos() / 1_000_000_000.0;
        totalSeconds += lapSeconds;
        lastLap = now;
        return new Lap(lapSeconds, totalSeconds);
    }

    @Value
    public static class Lap {
        double lapSeconds;
        double totalSeconds;
    }
}
