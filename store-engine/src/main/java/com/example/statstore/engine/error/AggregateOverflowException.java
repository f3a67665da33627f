package com.example.statstore.engine.error;

// The fold was refused before any write because a running sum would leave the double range
public class AggregateOverflowException extends StatStoreException {

    public static final String MARKER = "AGGREGATE_OVERFLOW";

    public AggregateOverflowException(String msg) {
        super(msg);
    }

    public AggregateOverflowException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
