package com.myinfra.deployments.ownership.model;

import java.util.List;

/**
 * Applications sharing the same owner, for display.
 *
 * @param owner        The shared owner
 * @param applications Applications of that owner in input order
 * @param userGroup    Whether the owner is the user or one of the user's groups
 * @param accessLevel  Access the user has on the group as a whole
 */
public record ApplicationGroup(
        OwnerDescriptor owner,
        List<Application> applications,
        boolean userGroup,
        AccessLevel accessLevel) {

    public int size() {
        return applications.size();
    }
}
