package com.example.statstore.engine.connection;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.error.NotConnectedException;
import com.example.statstore.engine.store.StatStore;
import com.example.statstore.engine.store.memory.MemoryStoreConnector;
import com.example.statstore.engine.store.redis.RedisStoreConnector;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.List;

// Reference-counted store connection. Owned ones close on the last release, attached ones never here.
@Slf4j
public class StoreConnectionManager {

    private final StatsSettings settings;
    private final List<StoreConnector> connectors;
    private final Object lock = new Object();

    private int references;
    private StoreConnection owned;
    private String ownedUrl;
    private StoreConnection attached;

    public StoreConnectionManager(StatsSettings settings) {
        this(settings, List.of(new RedisStoreConnector(), new MemoryStoreConnector()));
    }

    public StoreConnectionManager(StatsSettings settings, List<StoreConnector> connectors) {
        this.settings = settings;
        this.connectors = List.copyOf(connectors);
    }

    public StoreConnection openConnection() {
        return openConnection(settings.getUrl());
    }

    public StoreConnection openConnection(String url) {
        synchronized (lock) {
            StoreConnection connection;
            if (attached != null) {
                connection = attached;
            } else if (owned != null) {
                if (!url.equals(ownedUrl)) {
                    log.warn("Connection to {} already open, ignoring request for {}", ownedUrl, url);
                }
                connection = owned;
            } else {
                connection = connect(url);
            }
            references++;
            log.debug("Store reference acquired, {} outstanding", references);
            return connection;
        }
    }

    public StoreLease acquire() {
        return new StoreLease(this, openConnection());
    }

    public void close() {
        synchronized (lock) {
            if (references == 0) {
                throw new NotConnectedException("close() without a matching openConnection()");
            }
            references--;
            log.debug("Store reference released, {} outstanding", references);
            if (references == 0 && owned != null) {
                StoreConnection closing = owned;
                owned = null;
                ownedUrl = null;
                closing.close();
                log.info("Store connection closed");
            }
        }
    }

    public void attach(StatStore reader, StatStore writer) {
        synchronized (lock) {
            attached = StoreConnection.external(reader, writer);
            log.info("Attached external store connection");
        }
    }

    public void detach() {
        synchronized (lock) {
            attached = null;
        }
    }

    public StatStore reader() {
        return connection().getReader();
    }

    public StatStore writer() {
        return connection().getWriter();
    }

    public StoreConnection connection() {
        synchronized (lock) {
            if (attached != null) {
                return attached;
            }
            if (references > 0 && owned != null) {
                return owned;
            }
            throw new NotConnectedException("No open store connection and none attached");
        }
    }

    public int references() {
        synchronized (lock) {
            return references;
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return attached != null || owned != null;
        }
    }

    public StatsSettings getSettings() {
        return settings;
    }

    private StoreConnection connect(String url) {
        URI uri = URI.create(url);
        StoreConnector connector = connectors.stream()
                .filter(candidate -> candidate.supports(uri))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No store connector for URL scheme: " + uri.getScheme()));
        owned = connector.connect(uri, settings);
        ownedUrl = url;
        log.info("Store connection opened: {}", redact(uri));
        return owned;
    }

    private static String redact(URI uri) {
        return uri.getScheme() + "://" + (uri.getHost() == null ? "" : uri.getHost())
                + (uri.getPort() < 0 ? "" : ":" + uri.getPort());
    }
}
