package com.example.statstore.engine.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

// Built by fromEnvironment outside Spring, bound from stats.* properties inside Boot
@Data
@Slf4j
public class StatsSettings {

    public static final String ENV_PREFIX = "STATS_STORE";

    private int historySize = 1000;
    private String timezone = "Europe/London";
    private String namespace = "STATS-STORE";
    private String url = "redis://127.0.0.1:6379";
    private Duration ttl = Duration.ofDays(14);
    private Duration contextTtl = Duration.ofDays(14);
    private Duration commandTimeout = Duration.ofSeconds(5);
    private int maxContextBytes = 1024 * 1024;
    private int scanBatchSize = 500;

    public static StatsSettings defaults() {
        return new StatsSettings();
    }

    public static StatsSettings fromEnvironment(Map<String, String> env) {
        StatsSettings settings = new StatsSettings();
        String historySize = env.get(ENV_PREFIX + "_HISTORY_SIZE");
        if (historySize != null) {
            settings.setHistorySize(parseInt(ENV_PREFIX + "_HISTORY_SIZE", historySize));
        }
        String timezone = env.get(ENV_PREFIX + "_TIMEZONE");
        if (timezone != null) {
            settings.setTimezone(timezone);
        }
        String namespace = env.get(ENV_PREFIX + "_NAMESPACE");
        String legacyPrefix = env.get(ENV_PREFIX + "_DEFAULT_PREFIX");
        if (namespace != null) {
            settings.setNamespace(namespace);
        } else if (legacyPrefix != null) {
            log.warn("{}_DEFAULT_PREFIX is deprecated, use {}_NAMESPACE", ENV_PREFIX, ENV_PREFIX);
            settings.setNamespace(legacyPrefix);
        }
        String url = env.get(ENV_PREFIX + "_URL");
        if (url != null) {
            settings.setUrl(url);
        }
        String ttl = env.get(ENV_PREFIX + "_TTL");
        if (ttl != null) {
            settings.setTtl(parseDuration(ENV_PREFIX + "_TTL", ttl));
        }
        String commandTimeout = env.get(ENV_PREFIX + "_COMMAND_TIMEOUT");
        if (commandTimeout != null) {
            settings.setCommandTimeout(parseDuration(ENV_PREFIX + "_COMMAND_TIMEOUT", commandTimeout));
        }
        settings.validate();
        return settings;
    }

    /**
     * @deprecated kept for configurations written against the old property name, use {@link #setNamespace(String)}
     */
    @Deprecated
    public void setDefaultPrefix(String defaultPrefix) {
        log.warn("'default-prefix' is deprecated, use 'namespace'");
        this.namespace = defaultPrefix;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public void validate() {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be positive, got " + historySize);
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero() || contextTtl == null || contextTtl.isNegative() || contextTtl.isZero()) {
            throw new IllegalArgumentException("ttl and contextTtl must be positive");
        }
        if (maxContextBytes < 1) {
            throw new IllegalArgumentException("maxContextBytes must be positive, got " + maxContextBytes);
        }
        zoneId();
    }

    // One "OPTION = value" pair per recognized option, used for the startup log
    public Map<String, String> describe() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put(ENV_PREFIX + "_HISTORY_SIZE", String.valueOf(historySize));
        options.put(ENV_PREFIX + "_TIMEZONE", timezone);
        options.put(ENV_PREFIX + "_NAMESPACE", namespace);
        options.put(ENV_PREFIX + "_URL", url);
        options.put(ENV_PREFIX + "_TTL", String.valueOf(ttl));
        options.put(ENV_PREFIX + "_COMMAND_TIMEOUT", String.valueOf(commandTimeout));
        return options;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    private static Duration parseDuration(String name, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException(name + " is neither seconds nor an ISO-8601 duration: " + value, e);
        }
    }
}
