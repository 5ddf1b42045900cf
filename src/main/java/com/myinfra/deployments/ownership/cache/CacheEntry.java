package com.myinfra.deployments.ownership.cache;

import com.myinfra.deployments.ownership.model.OwnershipSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * @param snapshot   Cached snapshot
 * @param computedAt When the snapshot was stored
 * @param ttl        How long the snapshot may be served
 */
public record CacheEntry(
        OwnershipSnapshot snapshot,
        Instant computedAt,
        Duration ttl) {

    /**
     * @return true while {@code now - computedAt <= ttl}
     */
    public boolean isFresh(Instant now) {
        return !now.isAfter(computedAt.plus(ttl));
    }
}
