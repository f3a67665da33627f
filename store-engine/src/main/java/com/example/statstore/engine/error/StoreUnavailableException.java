package com.example.statstore.engine.error;

/**
 * The store refused or dropped the connection. Never retried internally.
 */
public class StoreUnavailableException extends StatStoreException {

    public StoreUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
