package com.example.statstore.engine.aggregate;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashSet;
import java.util.Set;

// errors__all counts every failure, errors__EXC:<SimpleName> counts them by kind
public final class ErrorLabels {

    public static final String PREFIX = "errors__";
    public static final String ALL = "all";
    public static final String EXCEPTION_KIND = "EXC:";

    private ErrorLabels() {
    }

    public static String errorLabel(String name) {
        return PREFIX + name;
    }

    public static String kindName(Throwable failure) {
        String simpleName = failure.getClass().getSimpleName();
        return EXCEPTION_KIND + (simpleName.isEmpty() ? failure.getClass().getName() : simpleName);
    }

    /**
     * Full labels for the given names plus {@code errors__all}, without duplicates.
     */
    public static Set<String> labels(String... names) {
        Set<String> labels = new LinkedHashSet<>();
        for (String name : names) {
            labels.add(errorLabel(name));
        }
        labels.add(errorLabel(ALL));
        return labels;
    }

    public static Set<String> labels(Throwable failure, String... additionalNames) {
        String[] names = new String[additionalNames.length + 1];
        names[0] = kindName(failure);
        System.arraycopy(additionalNames, 0, names, 1, additionalNames.length);
        return labels(names);
    }

    public static String stackTrace(Throwable failure) {
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }
}
