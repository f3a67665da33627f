package com.example.statstore.engine.connection;

import com.example.statstore.engine.store.StatStore;

import java.util.concurrent.atomic.AtomicBoolean;

// Releases its reference on the manager exactly once
public final class StoreLease implements AutoCloseable {

    private final StoreConnectionManager manager;
    private final StoreConnection connection;
    private final AtomicBoolean released = new AtomicBoolean();

    StoreLease(StoreConnectionManager manager, StoreConnection connection) {
        this.manager = manager;
        this.connection = connection;
    }

    public StatStore reader() {
        return connection.getReader();
    }

    public StatStore writer() {
        return connection.getWriter();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.close();
        }
    }
}
