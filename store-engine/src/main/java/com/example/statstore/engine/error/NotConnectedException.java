package com.example.statstore.engine.error;

/**
 * Thrown when the store is used with no outstanding connection reference and nothing attached.
 */
public class NotConnectedException extends StatStoreException {

    public NotConnectedException(String msg) {
        super(msg);
    }
}
