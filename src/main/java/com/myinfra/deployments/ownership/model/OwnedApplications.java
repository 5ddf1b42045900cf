package com.myinfra.deployments.ownership.model;

import java.util.List;

/**
 * Applications a user owns, split by how ownership was established.
 *
 * @param directlyOwned Owned by the user
 * @param groupOwned    Owned by one of the user's groups and not directly
 * @param allOwned      directlyOwned followed by groupOwned
 */
public record OwnedApplications(
        List<Application> directlyOwned,
        List<Application> groupOwned,
        List<Application> allOwned) {
}
