package com.workflow.admission.config;

import com.workflow.admission.ratelimit.core.RateLimitEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops windows and blocks that have both elapsed. */
@Component
public class StoreSweeper {

    private static final Logger log = LoggerFactory.getLogger(StoreSweeper.class);

    private final RateLimitEngine engine;

    public StoreSweeper(RateLimitEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${admission.rate-limiter.store.sweep-interval:PT1M}")
    public void sweep() {
        engine.sweepExpired().subscribe(
                removed -> {
                    if (removed > 0) log.debug("swept {} expired entries", removed);
                },
                e -> log.warn("sweep of expired entries failed: {}", e.toString()));
    }
}
