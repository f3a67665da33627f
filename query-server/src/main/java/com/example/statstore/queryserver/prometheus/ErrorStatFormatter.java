package com.example.statstore.queryserver.prometheus;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.engine.aggregate.ErrorLabels;
import com.example.statstore.queryserver.model.StatSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exports error counters as {@code <NAMESPACE>_ERROR_COUNT}. {@code errors__EXC:TimeoutError}
 * carries the label {@code EXC="TimeoutError"}; a plain name such as {@code errors__all} carries
 * {@code error="all"}.
 */
public class ErrorStatFormatter implements StatFormatter {

    private static final String PART_SEPARATOR = "__";

    private final String metricPrefix;

    public ErrorStatFormatter(String namespace) {
        this.metricPrefix = namespace.toUpperCase(Locale.ROOT) + "_ERROR";
    }

    @Override
    public List<String> format(String label, Aggregate aggregate) {
        String[] parts = label.substring(ErrorLabels.PREFIX.length()).split(PART_SEPARATOR);
        Map<String, String> labels = new LinkedHashMap<>();
        for (String part : parts) {
            int colon = part.indexOf(':');
            if (colon < 0) {
                labels.clear();
                labels.put("error", parts[parts.length - 1]);
                break;
            }
            labels.put(part.substring(0, colon), part.substring(colon + 1));
        }
        return MetricLines.lines(metricPrefix, labels, aggregate, List.of(StatSummary.COUNT));
    }
}
