package com.example.statstore.queryserver.config;

import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

// Holds one store reference for the lifetime of the application
@Slf4j
@Component
public class StoreLifecycle {

    private final StoreConnectionManager connections;
    private final StatsSettings settings;

    public StoreLifecycle(StoreConnectionManager connections, StatsSettings settings) {
        this.connections = connections;
        this.settings = settings;
    }

    @PostConstruct
    public void open() {
        settings.describe().forEach((option, value) -> log.info("{} = {}", option, value));
        connections.openConnection();
    }

    @PreDestroy
    public void close() {
        connections.close();
    }
}
