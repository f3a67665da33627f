package com.example.statstore.engine.store;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

// Everything one atomic fold needs: the label's keys plus the observation
@Value
@Builder
public class FoldCommand {
    String countKey;
    String totalKey;
    String totalSquaresKey;
    String minKey;
    String maxKey;
    String lastKey;
    String lastTimeKey;
    String historyKey;

    double value;
    String timestamp;    // Unix seconds, already formatted
    String historyEntry; // Encoded history line
    int historySize;
    Duration ttl;

    // Order matters: the fold script addresses keys by position
    public List<String> keys() {
        return List.of(countKey, totalKey, totalSquaresKey, minKey, maxKey, lastKey, lastTimeKey, historyKey);
    }
}
