package com.workflow.admission.config;

import com.workflow.admission.ratelimit.core.LimiterConfig;
import com.workflow.admission.ratelimit.rule.HeaderMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "admission.rate-limiter")
public record RateLimiterProperties(
        @NotBlank @Pattern(regexp = "memory|redis") String backend,
        HeaderMode headerMode,
        List<String> whitelist,
        @NotEmpty Map<String, @Valid LimiterSpec> limiters,
        @NotNull @Valid Tiers tiers,
        @Valid Store store,
        @Valid Credentials credentials,
        @Valid Redis redis
) {
    public RateLimiterProperties {
        if (headerMode == null) headerMode = HeaderMode.LEGACY;
        if (whitelist == null) whitelist = List.of();
        if (store == null) store = new Store(true, "windowStore", Duration.ofMinutes(1));
        if (credentials == null) credentials = new Credentials(List.of("/api/auth/"), DataSize.ofKilobytes(16));
        if (redis == null) redis = new Redis("localhost", 6379, 0, null, Duration.ofMillis(500), "admission-control");
    }

    public record LimiterSpec(@Min(1) int points, @NotNull Duration duration, Duration blockDuration) {
        public LimiterConfig toConfig(String name) {
            long block = blockDuration == null ? 0 : blockDuration.toSeconds();
            return LimiterConfig.of(name, points, duration.toSeconds(), block);
        }
    }

    public record Tiers(
            @NotBlank String defaultTier,
            @NotNull Duration duration,
            Duration blockDuration,
            @NotEmpty Map<String, @Min(1) Integer> points
    ) {
        public long blockDurationSeconds() {
            return blockDuration == null ? 0 : blockDuration.toSeconds();
        }
    }

    public record Store(boolean resilient, @NotBlank String instanceName, @NotNull Duration sweepInterval) {
    }

    /** Endpoints whose submitted email/username is captured for credential-keyed limiters. */
    public record Credentials(@NotEmpty List<String> paths, @NotNull DataSize maxBody) {
    }

    /** Connection of the shared window store, used only with the redis backend. */
    public record Redis(
            @NotBlank String host,
            @Min(1) int port,
            @Min(0) int database,
            String password,
            @NotNull Duration commandTimeout,
            String clientName
    ) {
    }
}
