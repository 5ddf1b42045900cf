package com.myinfra.deployments.ownership.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.config.AppConfig.OwnershipConfig;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Per-user ownership snapshots with bounded staleness.
 *
 * <p>Entries are served while {@code now - computedAt <= ttl}. Expiry is detected
 * on read and the expired entry is evicted then. Caffeine only bounds the number
 * of resident entries; freshness is decided here against the injected clock.
 *
 * <p>Keys embed the full user reference, so {@link #invalidate(String)} can drop
 * entries by a partial reference. The application hash of a key is never matched.
 */
@Slf4j
@Component
public class OwnershipCache {

    private static final String KEY_PREFIX = "ownership:";

    private final Cache<String, CacheEntry> entries;
    private final Clock clock;
    private final Duration ttl;
    private final boolean enabled;

    public OwnershipCache(AppConfig appConfig, Clock clock) {
        OwnershipConfig config = appConfig.getOwnership();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = config.getCacheTtl();
        this.enabled = config.isCacheEnabled();
        this.entries = Caffeine.newBuilder()
                .maximumSize(config.getCacheMaxSize())
                .build();
    }

    /**
     * Builds the cache key for a user and the set of applications resolved for it.
     * Application order and duplicates do not change the key.
     *
     * @param userRef      User reference
     * @param applications Applications the snapshot covers
     * @return "ownership:{userRef}#{sha256 of sorted application names}"
     */
    public static String keyFor(String userRef, Collection<Application> applications) {
        TreeSet<String> names = new TreeSet<>();
        for (Application application : applications) {
            names.add(String.valueOf(application.name()));
        }
        return KEY_PREFIX + userRef + "#" + sha256(names);
    }

    public Optional<OwnershipSnapshot> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }

        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (!entry.isFresh(clock.instant())) {
            // a concurrent put may already have replaced the expired entry
            entries.asMap().remove(key, entry);
            log.debug("Ownership cache entry expired for key={}", key);
            return Optional.empty();
        }

        return Optional.of(entry.snapshot());
    }

    public void put(String key, OwnershipSnapshot snapshot) {
        if (!enabled) {
            return;
        }
        entries.put(key, new CacheEntry(snapshot, clock.instant(), ttl));
    }

    /**
     * Evicts the entry with exactly this key, and every entry whose key without its
     * application hash contains the given reference. Evicts everything when it is null.
     *
     * @param userRef Cache key, or a full or partial user reference
     *                (e.g., "ownership:user:default/alice", "user:default/alice" or "alice")
     */
    public void invalidate(String userRef) {
        if (userRef == null) {
            invalidateAll();
            return;
        }

        long before = entries.asMap().size();
        entries.asMap().keySet().removeIf(key -> key.equals(userRef) || ownerPartOf(key).contains(userRef));
        log.debug("Invalidated {} ownership cache entries matching '{}'", before - entries.asMap().size(), userRef);
    }

    public void invalidateAll() {
        entries.invalidateAll();
        log.debug("Invalidated all ownership cache entries");
    }

    public long size() {
        return entries.asMap().size();
    }

    /**
     * The key up to its "#" hash separator, prefix included.
     */
    private static String ownerPartOf(String key) {
        int hash = key.lastIndexOf('#');
        return hash < 0 ? key : key.substring(0, hash);
    }

    // each name is length-prefixed so that {"a\nb"} and {"a", "b"} hash differently
    private static String sha256(Collection<String> names) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String name : names) {
                byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
                digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
                digest.update(bytes);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
