package com.workflow.admission.ratelimit.core;

public record Consumption(long consumed, long remaining, long blockedUntilMs) {
}
