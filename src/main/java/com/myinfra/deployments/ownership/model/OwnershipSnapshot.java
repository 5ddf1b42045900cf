package com.myinfra.deployments.ownership.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ownership of a set of applications as seen by one user.
 * An application name is in at most one of {@code userOwnedNames} and the
 * {@code groupOwnedNames} buckets, and every owned name has an owner entry.
 *
 * @param userOwnedNames     Applications owned directly by the user
 * @param groupOwnedNames    Group name to applications owned by that group, for the user's groups only
 * @param ownerByApplication Application name to its owner
 * @param userGroups         Groups the user belongs to
 */
public record OwnershipSnapshot(
        Set<String> userOwnedNames,
        Map<String, Set<String>> groupOwnedNames,
        Map<String, OwnerDescriptor> ownerByApplication,
        Set<String> userGroups) {

    public OwnershipSnapshot {
        userOwnedNames = Collections.unmodifiableSet(new LinkedHashSet<>(userOwnedNames));
        Map<String, Set<String>> buckets = new LinkedHashMap<>();
        groupOwnedNames.forEach((group, names) ->
                buckets.put(group, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
        groupOwnedNames = Collections.unmodifiableMap(buckets);
        ownerByApplication = Collections.unmodifiableMap(new LinkedHashMap<>(ownerByApplication));
        userGroups = Collections.unmodifiableSet(new LinkedHashSet<>(userGroups));
    }

    public boolean isUserOwned(String applicationName) {
        return userOwnedNames.contains(applicationName);
    }

    public boolean isGroupOwned(String applicationName) {
        return owningGroup(applicationName).isPresent();
    }

    public boolean isOwned(String applicationName) {
        return isUserOwned(applicationName) || isGroupOwned(applicationName);
    }

    /**
     * @return the user's group owning the application, if any
     */
    public Optional<String> owningGroup(String applicationName) {
        return groupOwnedNames.entrySet().stream()
                .filter(bucket -> bucket.getValue().contains(applicationName))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Optional<OwnerDescriptor> ownerOf(String applicationName) {
        return Optional.ofNullable(ownerByApplication.get(applicationName));
    }
}
