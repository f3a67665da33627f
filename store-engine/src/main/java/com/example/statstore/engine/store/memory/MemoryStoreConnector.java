package com.example.statstore.engine.store.memory;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnection;
import com.example.statstore.engine.connection.StoreConnector;

import java.net.URI;
import java.time.Clock;

// memory:// gets a fresh process-local store per physical connection
public class MemoryStoreConnector implements StoreConnector {

    private final Clock clock;

    public MemoryStoreConnector() {
        this(Clock.systemUTC());
    }

    public MemoryStoreConnector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(URI url) {
        return "memory".equalsIgnoreCase(url.getScheme());
    }

    @Override
    public StoreConnection connect(URI url, StatsSettings settings) {
        InMemoryStatStore store = new InMemoryStatStore(clock);
        return new StoreConnection(store, store, () -> { });
    }
}
