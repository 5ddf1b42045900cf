package com.myinfra.deployments.ownership.model;

import java.util.List;
import java.util.Objects;

/**
 * Authenticated catalog user as asserted by the identity provider.
 *
 * @param userRef       Canonical user reference (e.g., "user:default/alice")
 * @param ownershipRefs References the user is identified by or belongs to
 *                      (e.g., "user:default/alice", "group:default/platform-team")
 */
public record UserIdentity(
        String userRef,
        List<String> ownershipRefs) {

    public UserIdentity {
        ownershipRefs = ownershipRefs == null
                ? List.of()
                : ownershipRefs.stream().filter(Objects::nonNull).toList();
    }
}
