package com.example.statstore.queryserver.prometheus;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// The formatter with the longest matching label prefix wins; the empty prefix holds the default
public class FormatterRegistry {

    private final Map<String, StatFormatter> formatters = new ConcurrentHashMap<>();

    public FormatterRegistry(StatFormatter defaultFormatter) {
        formatters.put("", defaultFormatter);
    }

    public FormatterRegistry register(String labelPrefix, StatFormatter formatter) {
        formatters.put(labelPrefix, formatter);
        return this;
    }

    public StatFormatter resolve(String label) {
        String best = "";
        for (String prefix : formatters.keySet()) {
            if (label.startsWith(prefix) && prefix.length() > best.length()) {
                best = prefix;
            }
        }
        return formatters.get(best);
    }
}
