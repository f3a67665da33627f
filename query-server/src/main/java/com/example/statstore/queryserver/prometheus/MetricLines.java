package com.example.statstore.queryserver.prometheus;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.queryserver.model.StatSummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

final class MetricLines {

    private MetricLines() {
    }

    /**
     * One {@code PREFIX_FIELD{labels} value} line per requested field. {@code last_time} is a
     * timestamp, not a measurement, and is never exported.
     */
    static List<String> lines(String metricPrefix, Map<String, String> labels, Aggregate aggregate, Collection<String> fields) {
        String renderedLabels = labels(labels);
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Double> field : StatSummary.fields(aggregate).entrySet()) {
            if (!fields.contains(field.getKey()) || StatSummary.LAST_TIME.equals(field.getKey()) || field.getValue() == null) {
                continue;
            }
            lines.add(metricName(metricPrefix + "_" + field.getKey().toUpperCase(Locale.ROOT)) + renderedLabels
                    + " " + field.getValue());
        }
        return lines;
    }

    static String labels(Map<String, String> labels) {
        if (labels.isEmpty()) {
            return "";
        }
        return labels.entrySet().stream()
                .map(label -> metricName(label.getKey()) + "=\"" + escape(label.getValue()) + "\"")
                .collect(Collectors.joining(",", "{", "}"));
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"");
    }

    // Characters outside [a-zA-Z0-9_:] are not allowed in metric or label names
    static String metricName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == ':'
                    || (i > 0 && c >= '0' && c <= '9');
            sb.append(allowed ? c : '_');
        }
        return sb.toString();
    }
}
