package com.example.statstore.engine.store;

import java.math.BigDecimal;

public final class StoreValues {

    private StoreValues() {
    }

    // Plain decimal notation, never exponent form
    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Value must be finite, got " + value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    /**
     * Parses a stored number. Absent, empty, malformed or non-finite input yields null.
     */
    public static Double parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
