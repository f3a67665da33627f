package com.example.statstore.engine.connection;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.error.NotConnectedException;
import com.example.statstore.engine.store.memory.InMemoryStatStore;
import com.example.statstore.engine.store.memory.MemoryStoreConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreConnectionManagerTest {

    @Mock
    private StoreConnector connector;

    private final AtomicInteger physicalCloses = new AtomicInteger();
    private InMemoryStatStore store;
    private StoreConnectionManager manager;

    @BeforeEach
    void setUp() {
        StatsSettings settings = StatsSettings.defaults();
        store = new InMemoryStatStore();
        manager = new StoreConnectionManager(settings, List.of(connector));
    }

    private void connectorOpensStore() {
        when(connector.supports(any(URI.class))).thenReturn(true);
        when(connector.connect(any(URI.class), any(StatsSettings.class)))
                .thenReturn(new StoreConnection(store, store, physicalCloses::incrementAndGet));
    }

    @Test
    void connectsOnFirstReferenceAndClosesOnLast() {
        connectorOpensStore();

        manager.openConnection();
        manager.openConnection();
        assertEquals(2, manager.references());

        manager.close();
        assertEquals(0, physicalCloses.get());
        assertSame(store, manager.reader());

        manager.close();
        assertEquals(1, physicalCloses.get());
        assertFalse(manager.isConnected());
        verify(connector, times(1)).connect(any(URI.class), any(StatsSettings.class));
    }

    @Test
    void leasesComposeWithExplicitOpens() {
        connectorOpensStore();

        manager.openConnection();
        StoreLease lease = manager.acquire();
        manager.close();

        assertSame(store, lease.writer());
        assertSame(store, manager.writer());
        assertEquals(0, physicalCloses.get());

        lease.close();
        lease.close();
        assertEquals(1, physicalCloses.get());
        assertEquals(0, manager.references());
    }

    @Test
    void reconnectsAfterFullClose() {
        connectorOpensStore();

        try (StoreLease ignored = manager.acquire()) {
            assertTrue(manager.isConnected());
        }
        try (StoreLease ignored = manager.acquire()) {
            assertTrue(manager.isConnected());
        }

        verify(connector, times(2)).connect(any(URI.class), any(StatsSettings.class));
        assertEquals(2, physicalCloses.get());
    }

    @Test
    void closeWithoutOpenFails() {
        assertThrows(NotConnectedException.class, manager::close);
    }

    @Test
    void readingWithoutConnectionFails() {
        assertThrows(NotConnectedException.class, manager::reader);
        assertThrows(NotConnectedException.class, manager::writer);
    }

    @Test
    void attachedConnectionIsNeverClosedByTheManager() {
        InMemoryStatStore reader = new InMemoryStatStore();
        InMemoryStatStore writer = new InMemoryStatStore();
        manager.attach(reader, writer);

        try (StoreLease lease = manager.acquire()) {
            assertSame(reader, lease.reader());
            assertSame(writer, lease.writer());
        }
        assertSame(reader, manager.reader());

        verifyNoInteractions(connector);
        assertEquals(0, physicalCloses.get());

        manager.detach();
        assertThrows(NotConnectedException.class, manager::reader);
    }

    @Test
    void rejectsUnknownScheme() {
        StoreConnectionManager memoryOnly = new StoreConnectionManager(StatsSettings.defaults(),
                List.of(new MemoryStoreConnector()));

        assertThrows(IllegalArgumentException.class, () -> memoryOnly.openConnection("ftp://localhost"));
        assertEquals(0, memoryOnly.references());
    }

    @Test
    void concurrentOpenAndCloseKeepTheCountExact() throws Exception {
        StatsSettings settings = StatsSettings.defaults();
        settings.setUrl("memory://local");
        StoreConnectionManager shared = new StoreConnectionManager(settings);
        shared.openConnection();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    try (StoreLease lease = shared.acquire()) {
                        lease.reader().getAll(List.of("k"));
                    }
                    shared.openConnection();
                    shared.close();
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, shared.references());
        shared.close();
        assertEquals(0, shared.references());
        assertFalse(shared.isConnected());
    }
}
