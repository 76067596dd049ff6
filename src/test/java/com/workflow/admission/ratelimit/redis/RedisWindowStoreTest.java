package com.workflow.admission.ratelimit.redis;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisWindowStoreTest {

    private ReactiveStringRedisTemplate redis;
    private ReactiveValueOperations<String, String> ops;
    private ReactiveHashOperations<String, Object, Object> hash;
    private RedisWindowStore store;

    private final ArgumentCaptor<List<String>> keys = listCaptor();
    private final ArgumentCaptor<List<String>> args = listCaptor();

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<String>> listCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(ReactiveStringRedisTemplate.class);
        ops = mock(ReactiveValueOperations.class);
        hash = mock(ReactiveHashOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        doReturn(hash).when(redis).opsForHash();
        store = new RedisWindowStore(redis);
    }

    private void scriptReplies(String reply) {
        when(redis.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), anyList()))
                .thenReturn(Flux.just(reply));
    }

    private void verifyScript() {
        verify(redis).execute(ArgumentMatchers.<RedisScript<String>>any(), keys.capture(), args.capture());
    }

    @Test
    void increment_runs_script_on_counter_key_and_parses_reply() {
        scriptReplies("1:3:9000:45000");

        StepVerifier.create(store.incrementHits("login:k", 10_000, 900_000, 1, 5))
                .expectNext(new WindowHits(true, 3, 9_000, 55_000))
                .verifyComplete();

        verifyScript();
        assertThat(keys.getValue()).containsExactly("rl:login:k");
        assertThat(args.getValue()).containsExactly("1", "900000", "5", "10000");
    }

    @Test
    void rejected_reply_is_not_accepted() {
        scriptReplies("0:5:0:1200");

        WindowHits hits = store.incrementHits("login:k", 0, 900_000, 1, 5).block();

        assertThat(hits.accepted()).isFalse();
        assertThat(hits.hits()).isEqualTo(5);
        assertThat(hits.resetAtMs()).isEqualTo(1_200);
    }

    @Test
    void empty_script_reply_is_an_error() {
        when(redis.execute(ArgumentMatchers.<RedisScript<String>>any(), anyList(), anyList()))
                .thenReturn(Flux.empty());

        StepVerifier.create(store.incrementHits("k", 0, 1_000, 1, 5))
                .expectError()
                .verify();
    }

    @Test
    void refund_names_the_window_it_targets() {
        scriptReplies("1:1:9000:30000");

        StepVerifier.create(store.refundHits("login:k", 20_000, 9_000, 1))
                .expectNext(new WindowHits(true, 1, 9_000, 50_000))
                .verifyComplete();

        verifyScript();
        assertThat(keys.getValue()).containsExactly("rl:login:k");
        assertThat(args.getValue()).containsExactly("1", "9000");
    }

    @Test
    void refund_for_any_window_passes_the_wildcard() {
        scriptReplies("0:0:-1:0");

        WindowHits hits = store.refundHits("k", 0, WindowStore.ANY_WINDOW, 2).block();

        assertThat(hits.accepted()).isFalse();
        verifyScript();
        assertThat(args.getValue()).containsExactly("2", "-1");
    }

    @Test
    void blocked_until_reads_block_key() {
        when(ops.get("rl:login:k:block")).thenReturn(Mono.just("123456"));
        when(ops.get("rl:other:block")).thenReturn(Mono.empty());

        assertThat(store.blockedUntil("login:k").block()).isEqualTo(123_456L);
        assertThat(store.blockedUntil("other").block()).isZero();
    }

    @Test
    void get_hits_reads_the_hit_field_and_defaults_to_zero() {
        when(hash.get("rl:k", "h")).thenReturn(Mono.just("4"));
        when(hash.get("rl:none", "h")).thenReturn(Mono.empty());

        assertThat(store.getHits("k", 0).block()).isEqualTo(4L);
        assertThat(store.getHits("none", 0).block()).isZero();
    }

    @Test
    void block_writes_deadline_and_drops_counter_in_one_script() {
        scriptReplies("OK");

        StepVerifier.create(store.block("k", 1_000, 61_000)).verifyComplete();

        verifyScript();
        assertThat(keys.getValue()).containsExactly("rl:k", "rl:k:block");
        assertThat(args.getValue()).containsExactly("61000", "60000");
    }

    @Test
    void block_ttl_comes_from_the_given_time_not_the_wall_clock() {
        scriptReplies("OK");

        store.block("k", 5_000, 5_250).block();

        verifyScript();
        assertThat(args.getValue()).containsExactly("5250", "250");
    }

    @Test
    void reset_deletes_counter_and_block() {
        when(redis.delete("rl:k", "rl:k:block")).thenReturn(Mono.just(2L));

        StepVerifier.create(store.resetKey("k")).verifyComplete();

        verify(redis).delete("rl:k", "rl:k:block");
    }

    @Test
    void sweep_is_left_to_key_expiry() {
        StepVerifier.create(store.deleteOldHits(Long.MAX_VALUE))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    void timed_list_entry_expires_with_its_key() {
        when(ops.set("blacklist:1.2.3.4", "601000", Duration.ofSeconds(600))).thenReturn(Mono.just(true));

        StepVerifier.create(store.addToList(AccessList.BLACKLIST, "1.2.3.4", 1_000, 601_000)).verifyComplete();

        verify(ops).set("blacklist:1.2.3.4", "601000", Duration.ofSeconds(600));
    }

    @Test
    void permanent_list_entry_has_no_ttl() {
        when(ops.set("whitelist:user:ops", "0")).thenReturn(Mono.just(true));
        when(ops.get("whitelist:user:ops")).thenReturn(Mono.just("0"));
        when(ops.get("whitelist:other")).thenReturn(Mono.empty());

        store.addToList(AccessList.WHITELIST, "user:ops", 0, WindowStore.NO_EXPIRY).block();

        verify(ops).set("whitelist:user:ops", "0");
        assertThat(store.listedUntil(AccessList.WHITELIST, "user:ops").block()).isEqualTo(WindowStore.NO_EXPIRY);
        assertThat(store.listedUntil(AccessList.WHITELIST, "other").block()).isZero();
    }

    @Test
    void remove_from_list_deletes_the_entry() {
        when(redis.delete("blacklist:1.2.3.4")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.removeFromList(AccessList.BLACKLIST, "1.2.3.4")).verifyComplete();

        verify(redis).delete("blacklist:1.2.3.4");
    }

    @Test
    void malformed_reply_is_rejected() {
        assertThatThrownBy(() -> RedisWindowStore.parse("garbage", 0))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RedisWindowStore.parse("1:2:3", 0))
                .isInstanceOf(IllegalStateException.class);
    }
}
