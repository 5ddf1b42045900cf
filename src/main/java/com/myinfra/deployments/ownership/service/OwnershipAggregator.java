package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.EnrichmentResult;
import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import com.myinfra.deployments.ownership.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies applications as owned by the user, owned by one of the user's
 * groups, or neither. Does not cache.
 *
 * <p>Each distinct owner reference is parsed and enriched once. The snapshot is
 * assembled in memory after all lookups completed, so a cancelled resolution
 * leaves nothing behind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OwnershipAggregator {

    private final OwnerReferenceParser parser;
    private final DisplayNameEnricher enricher;
    private final AppConfig appConfig;

    /**
     * Builds the ownership snapshot of {@code applications} for {@code user}.
     *
     * @param user         Identity with a non-blank user reference
     * @param applications Applications to classify, in input order
     * @return the snapshot; never errors on catalog failures
     */
    public Mono<OwnershipSnapshot> aggregate(UserIdentity user, List<Application> applications) {
        Set<String> ownerRefs = new LinkedHashSet<>();
        applications.forEach(app -> app.ownerReference().ifPresent(ownerRefs::add));

        return Flux.fromIterable(ownerRefs)
                .flatMap(ref -> enricher.enrich(parser.parse(ref))
                                .map(result -> Map.entry(ref, result)),
                        appConfig.getOwnership().getEnrichmentConcurrency())
                .collectMap(Map.Entry::getKey, entry -> entry.getValue().descriptor())
                .map(owners -> assemble(user, applications, owners));
    }

    /**
     * Groups the user belongs to: names of "group:" / "Group:" ownership references.
     *
     * @param user The user
     * @return group names in claim order, without duplicates
     */
    public Set<String> userGroupsOf(UserIdentity user) {
        Set<String> groups = new LinkedHashSet<>();
        for (String ref : user.ownershipRefs()) {
            if (ref.startsWith("group:") || ref.startsWith("Group:")) {
                groups.add(OwnerReferenceParser.nameOf(ref));
            }
        }
        return groups;
    }

    OwnershipSnapshot assemble(UserIdentity user, List<Application> applications, Map<String, OwnerDescriptor> owners) {
        Set<String> userGroups = userGroupsOf(user);

        Set<String> userOwned = new LinkedHashSet<>();
        Map<String, Set<String>> groupOwned = new LinkedHashMap<>();
        Map<String, OwnerDescriptor> ownerByApplication = new LinkedHashMap<>();

        for (Application app : applications) {
            String name = app.name();

            if (ownerByApplication.containsKey(name)) {
                log.warn("Application '{}' listed more than once, last occurrence wins", name);
                forget(name, userOwned, groupOwned);
            }

            Optional<String> ownerRef = app.ownerReference();
            if (ownerRef.isEmpty()) {
                ownerByApplication.put(name, OwnerDescriptor.unassigned());
                continue;
            }

            String raw = ownerRef.get();
            OwnerDescriptor owner = owners.getOrDefault(raw, parser.parse(raw));
            ownerByApplication.put(name, owner);

            switch (owner.kind()) {
                case USER -> {
                    if (isDirectOwner(user, raw, owner)) {
                        userOwned.add(name);
                    }
                }
                case GROUP -> {
                    if (userGroups.contains(owner.canonicalName())) {
                        groupOwned.computeIfAbsent(owner.canonicalName(), g -> new LinkedHashSet<>()).add(name);
                    }
                }
            }
        }

        return new OwnershipSnapshot(userOwned, groupOwned, ownerByApplication, userGroups);
    }

    /**
     * A user owner only counts when the owner names this user AND the identity
     * provider lists the owner among the user's ownership references.
     */
    private boolean isDirectOwner(UserIdentity user, String raw, OwnerDescriptor owner) {
        String userName = OwnerReferenceParser.nameOf(user.userRef());
        boolean namesUser = userName.equals(owner.canonicalName()) || user.userRef().equals(raw);

        boolean claimed = user.ownershipRefs().stream()
                .anyMatch(ref -> ref.equals(raw) || OwnerReferenceParser.nameOf(ref).equals(owner.canonicalName()));

        return namesUser && claimed;
    }

    private static void forget(String name, Set<String> userOwned, Map<String, Set<String>> groupOwned) {
        userOwned.remove(name);
        groupOwned.values().forEach(bucket -> bucket.remove(name));
        groupOwned.values().removeIf(Set::isEmpty);
    }
}
