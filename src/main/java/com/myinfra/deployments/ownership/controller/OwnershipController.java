package com.myinfra.deployments.ownership.controller;

import com.myinfra.deployments.ownership.exception.InvalidIdentityException;
import com.myinfra.deployments.ownership.model.AccessResponse;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.ApplicationGroup;
import com.myinfra.deployments.ownership.model.ApplicationsRequest;
import com.myinfra.deployments.ownership.model.GroupMembershipRequest;
import com.myinfra.deployments.ownership.model.GroupSort;
import com.myinfra.deployments.ownership.model.OwnedApplications;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import com.myinfra.deployments.ownership.model.UserIdentity;
import com.myinfra.deployments.ownership.service.ApplicationGrouper;
import com.myinfra.deployments.ownership.service.IdentityService;
import com.myinfra.deployments.ownership.service.OwnershipResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * HTTP access to the ownership resolver for the calling user.
 * The caller is identified by its identity token; requests without a valid token get 401.
 */
@Slf4j
@RestController
@RequestMapping("/api/ownership")
@RequiredArgsConstructor
public class OwnershipController {

    private final IdentityService identityService;
    private final OwnershipResolver ownershipResolver;
    private final ApplicationGrouper applicationGrouper;

    @PostMapping("/snapshot")
    public Mono<OwnershipSnapshot> snapshot(ServerHttpRequest request,
                                            @Valid @RequestBody ApplicationsRequest body) {
        return caller(request)
                .flatMap(user -> ownershipResolver.resolve(user, body.applications()));
    }

    @PostMapping("/owned")
    public Mono<OwnedApplications> owned(ServerHttpRequest request,
                                         @Valid @RequestBody ApplicationsRequest body) {
        return caller(request)
                .flatMap(user -> ownershipResolver.resolveUserOwnership(user, body.applications()));
    }

    @PostMapping("/access")
    public Mono<AccessResponse> access(ServerHttpRequest request,
                                       @RequestBody Application application) {
        return caller(request)
                .flatMap(user -> ownershipResolver.accessLevel(user, application))
                .map(level -> new AccessResponse(application.name(), level));
    }

    @PostMapping("/groups")
    public Mono<List<ApplicationGroup>> groups(ServerHttpRequest request,
                                               @RequestParam(defaultValue = "NAME") GroupSort sortBy,
                                               @Valid @RequestBody ApplicationsRequest body) {
        return caller(request)
                .flatMap(user -> ownershipResolver.resolve(user, body.applications()))
                .map(snapshot -> applicationGrouper.sortGroups(
                        applicationGrouper.groupByOwner(body.applications(), snapshot), sortBy));
    }

    @PostMapping("/memberships")
    public Mono<List<String>> memberships(ServerHttpRequest request,
                                          @Valid @RequestBody GroupMembershipRequest body) {
        return caller(request)
                .map(user -> ownershipResolver.membersOf(user, body.groups()));
    }

    /**
     * Drops the caller's cached snapshots, e.g. after a group membership change.
     */
    @DeleteMapping("/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> invalidate(ServerHttpRequest request) {
        return caller(request)
                .flatMap(user -> {
                    // a null reference would clear every user's entries
                    if (user.userRef() == null || user.userRef().isBlank()) {
                        return Mono.<Void>error(new InvalidIdentityException("User identity has no user reference"));
                    }
                    log.debug("Invalidating ownership cache for {}", user.userRef());
                    ownershipResolver.invalidate(user.userRef());
                    return Mono.<Void>empty();
                })
                .then();
    }

    private Mono<UserIdentity> caller(ServerHttpRequest request) {
        return identityService.authenticate(request)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED,
                        "Missing or invalid identity token")));
    }
}
