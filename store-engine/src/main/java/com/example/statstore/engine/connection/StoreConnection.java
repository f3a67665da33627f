package com.example.statstore.engine.connection;

import com.example.statstore.engine.store.StatStore;

/**
 * A live reader/writer pair plus the action that physically releases it.
 */
public final class StoreConnection {

    private final StatStore reader;
    private final StatStore writer;
    private final Runnable closer;

    public StoreConnection(StatStore reader, StatStore writer, Runnable closer) {
        this.reader = reader;
        this.writer = writer;
        this.closer = closer;
    }

    // A connection owned by someone else; closing it does nothing
    public static StoreConnection external(StatStore reader, StatStore writer) {
        return new StoreConnection(reader, writer, () -> { });
    }

    public StatStore getReader() {
        return reader;
    }

    public StatStore getWriter() {
        return writer;
    }

    void close() {
        closer.run();
    }
}
