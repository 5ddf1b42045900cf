package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.catalog.CatalogClient;
import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.config.AppConfig.OwnershipConfig;
import com.myinfra.deployments.ownership.model.EnrichmentResult;
import com.myinfra.deployments.ownership.model.EnrichmentResult.Status;
import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Labels owners with the title the catalog knows them by.
 *
 * <p>Fail-open: a missing entity, a timeout or a catalog error leaves the
 * descriptor as parsed. The returned Mono never errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DisplayNameEnricher {

    private final CatalogClient catalogClient;
    private final AppConfig appConfig;

    public Mono<EnrichmentResult> enrich(OwnerDescriptor descriptor) {
        OwnershipConfig config = appConfig.getOwnership();
        if (!config.isEnrichmentEnabled()) {
            return Mono.just(EnrichmentResult.fallback(descriptor, Status.SKIPPED));
        }

        String entityRef = entityRefOf(descriptor);

        return Mono.defer(() -> catalogClient.findByRef(entityRef))
                .timeout(config.getEnrichmentTimeout())
                .map(entity -> EnrichmentResult.resolved(
                        descriptor.withDisplayName(entity.displayNameOr(descriptor.canonicalName()))))
                .defaultIfEmpty(EnrichmentResult.fallback(descriptor, Status.NOT_FOUND))
                .onErrorResume(e -> {
                    log.debug("Display name lookup failed for {}, keeping '{}': {}",
                            entityRef, descriptor.displayName(), e.toString());
                    return Mono.just(EnrichmentResult.fallback(descriptor, Status.UNAVAILABLE));
                });
    }

    /**
     * @return "Kind:default/name", e.g. "Group:default/platform-team"
     */
    static String entityRefOf(OwnerDescriptor descriptor) {
        return descriptor.kind().entityKind() + ":default/" + descriptor.canonicalName();
    }
}
