package com.example.statstore.engine.error;

public class InvalidContextException extends StatStoreException {

    public InvalidContextException(String msg) {
        super(msg);
    }
}
