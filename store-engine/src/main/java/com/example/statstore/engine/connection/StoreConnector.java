package com.example.statstore.engine.connection;

import com.example.statstore.engine.config.StatsSettings;

import java.net.URI;

/**
 * Knows how to physically open one kind of store, selected by URL scheme.
 */
public interface StoreConnector {

    boolean supports(URI url);

    StoreConnection connect(URI url, StatsSettings settings);
}
