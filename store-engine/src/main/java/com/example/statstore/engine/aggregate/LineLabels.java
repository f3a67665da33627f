package com.example.statstore.engine.aggregate;

import java.util.Map;
import java.util.stream.Collectors;

// Labels of the form name;key=value,key2=value2, opaque to the engine
public final class LineLabels {

    public static final String DIMENSION_SEPARATOR = ";";
    public static final String PAIR_SEPARATOR = ",";
    public static final String KEY_VALUE_SEPARATOR = "=";

    private static final char REPLACEMENT = '_';

    private LineLabels() {
    }

    public static String compose(String label, Map<String, String> extraLabels) {
        if (extraLabels == null || extraLabels.isEmpty()) {
            return label;
        }
        return label + DIMENSION_SEPARATOR + extraLabels.entrySet().stream()
                .map(entry -> safe(entry.getKey()) + KEY_VALUE_SEPARATOR + safe(entry.getValue()))
                .collect(Collectors.joining(PAIR_SEPARATOR));
    }

    // Separators and spaces become '_', backslashes are dropped
    public static String safe(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case ',':
                case ';':
                case '=':
                case ' ':
                    sb.append(REPLACEMENT);
                    break;
                case '\\':
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
