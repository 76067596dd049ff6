package com.workflow.admission.ratelimit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class LimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(LimiterRegistry.class);

    private final ConcurrentMap<String, LimiterConfig> limiters = new ConcurrentHashMap<>();

    public LimiterConfig create(String name, int points, long durationSeconds, long blockDurationSeconds) {
        return register(LimiterConfig.of(name, points, durationSeconds, blockDurationSeconds));
    }

    /** Registers {@code config}, replacing whatever was registered under the same name. */
    public LimiterConfig register(LimiterConfig config) {
        validate(config);
        LimiterConfig previous = limiters.put(config.name(), config);
        if (previous == null) {
            log.info("registered limiter {}: {} points / {}s, block {}s",
                    config.name(), config.points(), config.durationSeconds(), config.blockDurationSeconds());
        } else if (!previous.equals(config)) {
            log.info("replaced limiter {}: {} -> {}", config.name(), previous, config);
        }
        return config;
    }

    public LimiterConfig createIfAbsent(LimiterConfig config) {
        validate(config);
        return limiters.computeIfAbsent(config.name(), n -> {
            log.info("registered limiter {}: {} points / {}s, block {}s",
                    n, config.points(), config.durationSeconds(), config.blockDurationSeconds());
            return config;
        });
    }

    public LimiterConfig get(String name) {
        LimiterConfig config = name == null ? null : limiters.get(name);
        if (config == null) {
            throw new ConfigurationException("Unknown limiter '" + name + "'");
        }
        return config;
    }

    public boolean contains(String name) {
        return name != null && limiters.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(limiters.keySet());
    }

    private static void validate(LimiterConfig c) {
        if (c == null) throw new ConfigurationException("limiter config is required");
        if (c.name() == null || c.name().isBlank()) throw new ConfigurationException("limiter name is required");
        if (c.points() <= 0) throw new ConfigurationException("limiter '" + c.name() + "': points must be > 0");
        if (c.durationSeconds() <= 0) throw new ConfigurationException("limiter '" + c.name() + "': duration must be > 0");
        if (c.blockDurationSeconds() < 0) throw new ConfigurationException("limiter '" + c.name() + "': blockDuration must be >= 0");
    }
}
