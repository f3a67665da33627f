package com.example.statstore.engine.error;

/**
 * Base of every failure raised by the stat store engine.
 */
public class StatStoreException extends RuntimeException {

    public StatStoreException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public StatStoreException(String msg) {
        super(msg);
    }
}
