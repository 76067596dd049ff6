package com.workflow.admission.ratelimit.core;

import java.time.Duration;

public record LimiterConfig(String name, int points, long durationSeconds, long blockDurationSeconds) {

    public static LimiterConfig of(String name, int points, long durationSeconds, long blockDurationSeconds) {
        return new LimiterConfig(name, points, durationSeconds, blockDurationSeconds);
    }

    public static LimiterConfig perMinute(String name, int points) { return new LimiterConfig(name, points, 60, 0); }

    public Duration window() { return Duration.ofSeconds(durationSeconds); }

    public Duration blockDuration() { return Duration.ofSeconds(blockDurationSeconds); }

    public boolean blocksOnExceed() { return blockDurationSeconds > 0; }
}
