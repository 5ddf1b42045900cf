package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.model.AccessLevel;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnedApplications;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import com.myinfra.deployments.ownership.model.UserIdentity;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * Resolves which applications a user owns and what they may do with them.
 *
 * <p>All methods reject an identity without a user reference with
 * {@link com.myinfra.deployments.ownership.exception.InvalidIdentityException},
 * thrown before any Mono is returned.
 */
public interface OwnershipResolver {

    /**
     * Ownership snapshot of the given applications, served from cache while fresh.
     */
    Mono<OwnershipSnapshot> resolve(UserIdentity user, List<Application> applications);

    /**
     * The given applications the user owns, directly or through a group.
     */
    Mono<OwnedApplications> resolveUserOwnership(UserIdentity user, List<Application> applications);

    Mono<AccessLevel> accessLevel(UserIdentity user, Application application);

    /**
     * @return the candidate groups the user is a member of, in the user's claim order
     */
    List<String> membersOf(UserIdentity user, Collection<String> candidateGroups);

    /**
     * Drops cached snapshots of every user whose reference contains {@code userRef}.
     */
    void invalidate(String userRef);

    void invalidateAll();
}
