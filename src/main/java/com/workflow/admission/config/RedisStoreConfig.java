package com.workflow.admission.config;

import com.workflow.admission.ratelimit.core.WindowStore;
import com.workflow.admission.ratelimit.redis.RedisWindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * Shared window store on Redis, configured from {@code admission.rate-limiter.redis.*}. Only
 * loaded with the redis backend; the memory backend opens no connection at all.
 */
@Configuration
@ConditionalOnProperty(name = "admission.rate-limiter.backend", havingValue = "redis")
public class RedisStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisStoreConfig.class);

    @Bean
    public LettuceConnectionFactory windowStoreConnectionFactory(RateLimiterProperties props) {
        var redis = props.redis();
        var server = new RedisStandaloneConfiguration(redis.host(), redis.port());
        server.setDatabase(redis.database());
        if (StringUtils.hasText(redis.password())) {
            server.setPassword(RedisPassword.of(redis.password()));
        }

        var client = LettuceClientConfiguration.builder().commandTimeout(redis.commandTimeout());
        if (StringUtils.hasText(redis.clientName())) {
            client.clientName(redis.clientName());
        }
        log.info("window store on redis {}:{}/{} (command timeout {})",
                redis.host(), redis.port(), redis.database(), redis.commandTimeout());
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    public ReactiveStringRedisTemplate windowStoreRedisTemplate(LettuceConnectionFactory windowStoreConnectionFactory) {
        return new ReactiveStringRedisTemplate(windowStoreConnectionFactory);
    }

    @Bean
    public WindowStore redisWindowStore(ReactiveStringRedisTemplate windowStoreRedisTemplate) {
        return new RedisWindowStore(windowStoreRedisTemplate);
    }
}
