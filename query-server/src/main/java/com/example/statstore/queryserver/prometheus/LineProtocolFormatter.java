package com.example.statstore.queryserver.prometheus;

import com.example.statstore.common.types.Aggregate;
import com.example.statstore.engine.aggregate.LineLabels;
import com.example.statstore.queryserver.model.StatSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default formatter. A label {@code SNMP_WORKER;ip=10.0.0.1,oid=sysName} becomes
 * {@code SNMP_WORKER_COUNT{ip="10.0.0.1",oid="sysName"} ...} and so on for every field. A label
 * without dimensions, or with malformed ones, is used whole as the metric prefix.
 */
public class LineProtocolFormatter implements StatFormatter {

    @Override
    public List<String> format(String label, Aggregate aggregate) {
        int split = label.indexOf(LineLabels.DIMENSION_SEPARATOR);
        if (split < 0) {
            return MetricLines.lines(label, Collections.emptyMap(), aggregate, StatSummary.FIELDS);
        }
        Map<String, String> labels = parseDimensions(label.substring(split + 1));
        if (labels == null) {
            return MetricLines.lines(label, Collections.emptyMap(), aggregate, StatSummary.FIELDS);
        }
        return MetricLines.lines(label.substring(0, split), labels, aggregate, StatSummary.FIELDS);
    }

    // Null when any pair lacks a '='
    static Map<String, String> parseDimensions(String dimensions) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String pair : dimensions.split(LineLabels.PAIR_SEPARATOR)) {
            int eq = pair.indexOf(LineLabels.KEY_VALUE_SEPARATOR);
            if (eq < 0) {
                return null;
            }
            labels.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return labels;
    }
}
