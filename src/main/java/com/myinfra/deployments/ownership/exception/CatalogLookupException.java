package com.myinfra.deployments.ownership.exception;

import lombok.Getter;

/**
 * Catalog could not answer a lookup (transport error, 5xx, open circuit).
 * Not-found is not an error and never raises this.
 */
@Getter
public class CatalogLookupException extends RuntimeException {

    private final String entityRef;

    public CatalogLookupException(String entityRef, Throwable cause) {
        super("Catalog lookup failed for " + entityRef + ": " + cause.getMessage(), cause);
        this.entityRef = entityRef;
    }
}
