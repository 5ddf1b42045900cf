package com.myinfra.deployments.ownership.catalog;

import com.myinfra.deployments.ownership.model.CatalogEntity;
import reactor.core.publisher.Mono;

/**
 * Read access to the software catalog.
 */
public interface CatalogClient {

    /**
     * Looks up an entity by its full reference.
     *
     * @param entityRef Reference of the form "Kind:namespace/name" (e.g., "Group:default/platform-team")
     * @return the entity, or an empty Mono when the catalog does not know it
     */
    Mono<CatalogEntity> findByRef(String entityRef);
}
