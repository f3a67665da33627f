package com.example.statstore.engine.error;

/**
 * A store round trip exceeded its deadline. The command may or may not have been applied;
 * callers decide whether a retry is safe.
 */
public class StoreTimeoutException extends StatStoreException {

    public StoreTimeoutException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
