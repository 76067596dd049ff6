package com.workflow.admission.ratelimit.redis;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Fixed window per key opened by the first hit; strict through Lua (no over-consumption).
 * Keys: "rl:{key}" is a hash holding the hit count ("h") and the window start ("s") with the
 * window as TTL, "rl:{key}:block" holds the block-until timestamp with the block period as TTL,
 * "{list}:{identifier}" holds a list entry. Expiry is left to Redis.
 */
public class RedisWindowStore implements WindowStore {

    static final String PREFIX = "rl:";
    static final String BLOCK_SUFFIX = ":block";
    static final String HITS_FIELD = "h";
    static final String PERMANENT = "0";

    // replies "accepted:hits:windowStart:ttlMs"
    private static final String INCREMENT = String.join("\n",
            "local current  = redis.call('HGET', KEYS[1], 'h')",
            "local points   = tonumber(ARGV[1])",
            "local windowMs = tonumber(ARGV[2])",
            "local capacity = tonumber(ARGV[3])",
            "if not current then",
            "  if points > capacity then return '0:0:' .. ARGV[4] .. ':' .. windowMs end",
            "  redis.call('HSET', KEYS[1], 'h', points, 's', ARGV[4])",
            "  redis.call('PEXPIRE', KEYS[1], windowMs)",
            "  return '1:' .. points .. ':' .. ARGV[4] .. ':' .. windowMs",
            "end",
            "local c     = tonumber(current)",
            "local start = redis.call('HGET', KEYS[1], 's')",
            "local ttl   = redis.call('PTTL', KEYS[1])",
            "if c + points > capacity then",
            "  return '0:' .. c .. ':' .. start .. ':' .. ttl",
            "end",
            "redis.call('HINCRBY', KEYS[1], 'h', points)",
            "return '1:' .. (c + points) .. ':' .. start .. ':' .. ttl"
    );

    // ARGV[2] is the window start to refund, or -1 for the live window
    private static final String REFUND = String.join("\n",
            "local current = redis.call('HGET', KEYS[1], 'h')",
            "if not current then return '0:0:' .. ARGV[2] .. ':0' end",
            "local start = redis.call('HGET', KEYS[1], 's')",
            "local ttl   = redis.call('PTTL', KEYS[1])",
            "local c     = tonumber(current)",
            "if ARGV[2] ~= '-1' and ARGV[2] ~= start then",
            "  return '0:' .. c .. ':' .. start .. ':' .. ttl",
            "end",
            "local newc = c - tonumber(ARGV[1])",
            "if newc < 0 then newc = 0 end",
            "redis.call('HSET', KEYS[1], 'h', newc)",
            "return '1:' .. newc .. ':' .. start .. ':' .. ttl"
    );

    private static final String BLOCK = String.join("\n",
            "redis.call('SET', KEYS[2], ARGV[1], 'PX', ARGV[2])",
            "redis.call('DEL', KEYS[1])",
            "return 'OK'"
    );

    private final RedisScript<String> incrementScript = new DefaultRedisScript<>(INCREMENT, String.class);
    private final RedisScript<String> refundScript = new DefaultRedisScript<>(REFUND, String.class);
    private final RedisScript<String> blockScript = new DefaultRedisScript<>(BLOCK, String.class);
    private final ReactiveStringRedisTemplate redis;

    public RedisWindowStore(ReactiveStringRedisTemplate redis) {
        this.redis = redis;
    }

    /** The counter key expires with its window, so {@code windowStartMs} is implied by the TTL. */
    @Override
    public Mono<Long> getHits(String key, long windowStartMs) {
        return redis.<String, String>opsForHash().get(counterKey(key), HITS_FIELD)
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<WindowHits> incrementHits(String key, long nowMs, long windowMs, long points, long capacity) {
        List<String> args = List.of(String.valueOf(points), String.valueOf(windowMs),
                String.valueOf(capacity), String.valueOf(nowMs));
        return redis.execute(incrementScript, List.of(counterKey(key)), args)
                .single()
                .map(res -> parse(res, nowMs));
    }

    @Override
    public Mono<WindowHits> refundHits(String key, long nowMs, long windowStartMs, long points) {
        List<String> args = List.of(String.valueOf(points), String.valueOf(windowStartMs));
        return redis.execute(refundScript, List.of(counterKey(key)), args)
                .single()
                .map(res -> parse(res, nowMs));
    }

    @Override
    public Mono<Long> blockedUntil(String key) {
        return redis.opsForValue().get(blockKey(key))
                .map(Long::parseLong)
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Void> block(String key, long nowMs, long untilMs) {
        long ttlMs = Math.max(1, untilMs - nowMs);
        return redis.execute(blockScript, List.of(counterKey(key), blockKey(key)),
                        List.of(String.valueOf(untilMs), String.valueOf(ttlMs)))
                .then();
    }

    @Override
    public Mono<Void> resetKey(String key) {
        return redis.delete(counterKey(key), blockKey(key)).then();
    }

    @Override
    public Mono<Long> deleteOldHits(long cutoffMs) {
        return Mono.just(0L);
    }

    @Override
    public Mono<Void> addToList(AccessList list, String identifier, long nowMs, long untilMs) {
        if (untilMs == NO_EXPIRY) {
            return redis.opsForValue().set(listKey(list, identifier), PERMANENT).then();
        }
        long ttlMs = Math.max(1, untilMs - nowMs);
        return redis.opsForValue()
                .set(listKey(list, identifier), String.valueOf(untilMs), Duration.ofMillis(ttlMs))
                .then();
    }

    @Override
    public Mono<Void> removeFromList(AccessList list, String identifier) {
        return redis.delete(listKey(list, identifier)).then();
    }

    @Override
    public Mono<Long> listedUntil(AccessList list, String identifier) {
        return redis.opsForValue().get(listKey(list, identifier))
                .map(v -> PERMANENT.equals(v) ? NO_EXPIRY : Long.parseLong(v))
                .defaultIfEmpty(0L);
    }

    static WindowHits parse(String res, long nowMs) {
        String[] parts = res.split(":");
        if (parts.length != 4) {
            throw new IllegalStateException("unexpected window reply: " + res);
        }
        long ttl = Math.max(0, Long.parseLong(parts[3]));
        return new WindowHits("1".equals(parts[0]), Long.parseLong(parts[1]), Long.parseLong(parts[2]), nowMs + ttl);
    }

    static String counterKey(String key) {
        return PREFIX + key;
    }

    static String blockKey(String key) {
        return PREFIX + key + BLOCK_SUFFIX;
    }

    static String listKey(AccessList list, String identifier) {
        return list.id() + ":" + identifier;
    }
}
