package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.cache.OwnershipCache;
import com.myinfra.deployments.ownership.exception.InvalidIdentityException;
import com.myinfra.deployments.ownership.model.AccessLevel;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnedApplications;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import com.myinfra.deployments.ownership.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OwnershipResolverService implements OwnershipResolver {

    private final OwnershipAggregator aggregator;
    private final AccessLevelEvaluator evaluator;
    private final OwnershipCache cache;

    @Override
    public Mono<OwnershipSnapshot> resolve(UserIdentity user, List<Application> applications) {
        requireValidIdentity(user);
        Objects.requireNonNull(applications, "applications must not be null");

        List<Application> snapshotOf = List.copyOf(applications);
        String key = OwnershipCache.keyFor(user.userRef(), snapshotOf);

        return Mono.defer(() -> {
            Optional<OwnershipSnapshot> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("Ownership cache hit for {}", user.userRef());
                return Mono.just(cached.get());
            }

            log.debug("Ownership cache miss for {}, resolving {} applications", user.userRef(), snapshotOf.size());
            return aggregator.aggregate(user, snapshotOf)
                    .doOnNext(snapshot -> cache.put(key, snapshot));
        });
    }

    @Override
    public Mono<OwnedApplications> resolveUserOwnership(UserIdentity user, List<Application> applications) {
        return resolve(user, applications).map(snapshot -> {
            List<Application> directlyOwned = new ArrayList<>();
            List<Application> groupOwned = new ArrayList<>();

            for (Application app : applications) {
                if (snapshot.isUserOwned(app.name())) {
                    directlyOwned.add(app);
                } else if (snapshot.isGroupOwned(app.name())) {
                    groupOwned.add(app);
                }
            }

            List<Application> allOwned = new ArrayList<>(directlyOwned);
            allOwned.addAll(groupOwned);

            return new OwnedApplications(List.copyOf(directlyOwned), List.copyOf(groupOwned), List.copyOf(allOwned));
        });
    }

    @Override
    public Mono<AccessLevel> accessLevel(UserIdentity user, Application application) {
        Objects.requireNonNull(application, "application must not be null");
        return resolve(user, List.of(application))
                .map(snapshot -> evaluator.evaluate(snapshot, application));
    }

    @Override
    public List<String> membersOf(UserIdentity user, Collection<String> candidateGroups) {
        requireValidIdentity(user);
        Objects.requireNonNull(candidateGroups, "candidateGroups must not be null");

        return aggregator.userGroupsOf(user).stream()
                .filter(candidateGroups::contains)
                .toList();
    }

    @Override
    public void invalidate(String userRef) {
        cache.invalidate(userRef);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    private static void requireValidIdentity(UserIdentity user) {
        if (user == null) {
            throw new InvalidIdentityException("User identity is required");
        }
        if (user.userRef() == null || user.userRef().isBlank()) {
            throw new InvalidIdentityException("User identity has no user reference");
        }
    }
}
