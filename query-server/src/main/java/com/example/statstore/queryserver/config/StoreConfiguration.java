package com.example.statstore.queryserver.config;

import com.example.statstore.engine.aggregate.ErrorLabels;
import com.example.statstore.engine.config.StatsSettings;
import com.example.statstore.engine.connection.StoreConnectionManager;
import com.example.statstore.engine.query.StatQueryService;
import com.example.statstore.engine.reactive.ReactiveStatQueryService;
import com.example.statstore.queryserver.prometheus.ErrorStatFormatter;
import com.example.statstore.queryserver.prometheus.FormatterRegistry;
import com.example.statstore.queryserver.prometheus.LineProtocolFormatter;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class StoreConfiguration {

    /**
     * Starts from the {@code STATS_STORE_*} variables, then applies any {@code stats.*} Spring
     * properties on top.
     */
    @Bean
    public StatsSettings statsSettings(Environment environment) {
        StatsSettings settings = StatsSettings.fromEnvironment(System.getenv());
        Binder.get(environment).bind("stats", Bindable.ofInstance(settings));
        settings.validate();
        return settings;
    }

    @Bean
    public StoreConnectionManager storeConnectionManager(StatsSettings settings) {
        return new StoreConnectionManager(settings);
    }

    @Bean
    public StatQueryService statQueryService(StoreConnectionManager connections, StatsSettings settings) {
        return new StatQueryService(connections, settings);
    }

    @Bean
    public ReactiveStatQueryService reactiveStatQueryService(StatQueryService queries) {
        return new ReactiveStatQueryService(queries);
    }

    @Bean
    public FormatterRegistry formatterRegistry(StatsSettings settings) {
        FormatterRegistry registry = new FormatterRegistry(new LineProtocolFormatter());
        registry.register(ErrorLabels.PREFIX, new ErrorStatFormatter(settings.getNamespace()));
        return registry;
    }
}
