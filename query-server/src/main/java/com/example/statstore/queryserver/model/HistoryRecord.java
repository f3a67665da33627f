package com.example.statstore.queryserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// One history entry as served over HTTP, with the timestamp also rendered in the configured zone
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecord {
    private double timestamp;
    private String time;
    private String label;
    private double value;
    @JsonProperty("context_id")
    private String contextId;
}
