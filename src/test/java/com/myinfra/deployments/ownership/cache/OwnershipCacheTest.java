package com.myinfra.deployments.ownership.cache;

import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import com.myinfra.deployments.ownership.model.OwnerKind;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OwnershipCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private AppConfig appConfig;
    private OwnershipCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        appConfig = new AppConfig();
        appConfig.getOwnership().setCacheTtl(TTL);
        cache = new OwnershipCache(appConfig, clock);
    }

    @Test
    @DisplayName("get should return the snapshot until exactly ttl has elapsed")
    void get_shouldServeFreshEntry_untilTtl() {
        OwnershipSnapshot snapshot = snapshotOwning("api");
        cache.put("ownership:user:default/alice#k", snapshot);

        clock.advance(TTL);

        assertThat(cache.get("ownership:user:default/alice#k")).contains(snapshot);
    }

    @Test
    @DisplayName("get should report absent and evict once ttl is exceeded")
    void get_shouldEvict_afterTtl() {
        cache.put("ownership:user:default/alice#k", snapshotOwning("api"));

        clock.advance(TTL.plusMillis(1));

        assertThat(cache.get("ownership:user:default/alice#k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("put should restart the ttl window for the key")
    void put_shouldRestartTtl() {
        cache.put("k", snapshotOwning("old"));
        clock.advance(Duration.ofMinutes(4));
        OwnershipSnapshot newer = snapshotOwning("new");
        cache.put("k", newer);
        clock.advance(Duration.ofMinutes(4));

        assertThat(cache.get("k")).contains(newer);
    }

    @Test
    @DisplayName("invalidate should remove only entries whose reference part contains the reference")
    void invalidate_shouldRemoveMatchingUsersOnly() {
        String aliceKey = OwnershipCache.keyFor("user:default/alice", List.of(Application.of("api", null)));
        String aliceOtherSet = OwnershipCache.keyFor("user:default/alice", List.of(Application.of("web", null)));
        String bobKey = OwnershipCache.keyFor("user:default/bob", List.of(Application.of("api", null)));
        cache.put(aliceKey, snapshotOwning("api"));
        cache.put(aliceOtherSet, snapshotOwning("web"));
        cache.put(bobKey, snapshotOwning("api"));

        cache.invalidate("alice");

        assertThat(cache.get(aliceKey)).isEmpty();
        assertThat(cache.get(aliceOtherSet)).isEmpty();
        assertThat(cache.get(bobKey)).isPresent();
    }

    @Test
    @DisplayName("invalidate should not match the application hash part of a key")
    void invalidate_shouldIgnoreHashPart() {
        String bobKey = OwnershipCache.keyFor("user:default/bob", List.of(Application.of("api", null)));
        cache.put(bobKey, snapshotOwning("api"));
        String hash = bobKey.substring(bobKey.lastIndexOf('#') + 1);

        cache.invalidate(hash.substring(0, 6));

        assertThat(cache.get(bobKey)).isPresent();
    }

    @Test
    @DisplayName("invalidate should remove the entry stored under an exact key")
    void invalidate_shouldRemoveExactKey() {
        String aliceKey = OwnershipCache.keyFor("user:default/alice", List.of(Application.of("api", null)));
        String aliceOtherSet = OwnershipCache.keyFor("user:default/alice", List.of(Application.of("web", null)));
        cache.put(aliceKey, snapshotOwning("api"));
        cache.put(aliceOtherSet, snapshotOwning("web"));

        cache.invalidate(aliceKey);

        assertThat(cache.get(aliceKey)).isEmpty();
        assertThat(cache.get(aliceOtherSet)).isPresent();
    }

    @Test
    @DisplayName("invalidate should accept the prefixed user reference")
    void invalidate_shouldMatchPrefixedReference() {
        String aliceKey = OwnershipCache.keyFor("user:default/alice", List.of(Application.of("api", null)));
        String bobKey = OwnershipCache.keyFor("user:default/bob", List.of(Application.of("api", null)));
        cache.put(aliceKey, snapshotOwning("api"));
        cache.put(bobKey, snapshotOwning("api"));

        cache.invalidate("ownership:user:default/alice");

        assertThat(cache.get(aliceKey)).isEmpty();
        assertThat(cache.get(bobKey)).isPresent();
    }

    @Test
    @DisplayName("invalidate without reference should clear everything")
    void invalidate_shouldClearAll_whenNull() {
        cache.put("ownership:user:default/alice#1", snapshotOwning("a"));
        cache.put("ownership:user:default/bob#2", snapshotOwning("b"));

        cache.invalidate(null);

        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("cache should neither store nor serve when disabled")
    void cache_shouldBeInert_whenDisabled() {
        appConfig.getOwnership().setCacheEnabled(false);
        OwnershipCache disabled = new OwnershipCache(appConfig, clock);

        disabled.put("k", snapshotOwning("api"));

        assertThat(disabled.get("k")).isEmpty();
        assertThat(disabled.size()).isZero();
    }

    @Test
    @DisplayName("keyFor should ignore application order and duplicates but not the set itself")
    void keyFor_shouldDependOnApplicationNameSet() {
        List<Application> ab = List.of(Application.of("a", null), Application.of("b", "x"));
        List<Application> ba = List.of(Application.of("b", null), Application.of("a", null), Application.of("a", null));
        List<Application> abc = List.of(Application.of("a", null), Application.of("b", null), Application.of("c", null));

        assertThat(OwnershipCache.keyFor("user:default/alice", ab))
                .isEqualTo(OwnershipCache.keyFor("user:default/alice", ba))
                .isNotEqualTo(OwnershipCache.keyFor("user:default/alice", abc))
                .isNotEqualTo(OwnershipCache.keyFor("user:default/bob", ab))
                .startsWith("ownership:user:default/alice#");
    }

    @Test
    @DisplayName("keyFor should not confuse a name containing a newline with two names")
    void keyFor_shouldKeepNameBoundaries() {
        List<Application> joined = List.of(Application.of("a\nb", null));
        List<Application> split = List.of(Application.of("a", null), Application.of("b", null));

        assertThat(OwnershipCache.keyFor("user:default/alice", joined))
                .isNotEqualTo(OwnershipCache.keyFor("user:default/alice", split));
    }

    // ==================== Concurrency ====================

    @Test
    @DisplayName("concurrent put, get and invalidate should leave a consistent cache")
    void cache_shouldStayConsistent_underConcurrentAccess() throws Exception {
        int threads = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                String user = "user:default/u" + t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        String key = OwnershipCache.keyFor(user, List.of(Application.of("app" + (i % 5), null)));
                        OwnershipSnapshot snapshot = snapshotOwning("app" + i);
                        cache.put(key, snapshot);
                        assertThat(cache.get(key)).isPresent();
                        if (i % 7 == 0) {
                            cache.invalidate(user);
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isLessThanOrEqualTo(threads * 5L);
    }

    @Test
    @DisplayName("the last put should win when writers race on one key")
    void put_shouldKeepLastWrite_whenWritersRace() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);

        try {
            for (int w = 0; w < writers; w++) {
                String name = "app" + w;
                executor.submit(() -> {
                    try {
                        start.await();
                        cache.put("k", snapshotOwning(name));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        OwnershipSnapshot winner = cache.get("k").orElseThrow();
        cache.put("k", snapshotOwning("final"));

        assertThat(winner.userOwnedNames()).hasSize(1).allMatch(name -> name.startsWith("app"));
        assertThat(cache.get("k")).hasValueSatisfying(s -> assertThat(s.userOwnedNames()).containsExactly("final"));
        assertThat(cache.size()).isEqualTo(1);
    }

    private static OwnershipSnapshot snapshotOwning(String name) {
        return new OwnershipSnapshot(Set.of(name), Map.of(),
                Map.of(name, new OwnerDescriptor(OwnerKind.USER, "alice", "alice")), Set.of());
    }
}
