package com.example.statstore.engine.error;

/**
 * A store key that was not produced by this namespace's key codec.
 */
public class UnrecognizedKeyException extends StatStoreException {

    private final String key;

    public UnrecognizedKeyException(String key) {
        super("Unrecognized store key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
