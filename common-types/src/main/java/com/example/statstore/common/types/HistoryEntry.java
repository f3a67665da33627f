package com.example.statstore.common.types;

import lombok.Builder;
import lombok.Data;

// One observation kept in a label's bounded history
@Data
@Builder
public class HistoryEntry {
    private double timestamp; // Unix seconds
    private String label;
    private double value;
    private String contextId; // Null when the observation carried no context
}
