package com.myinfra.deployments.ownership.model;

/**
 * Outcome of looking up an owner's display name in the catalog.
 * Every status carries a usable descriptor; only RESOLVED means the catalog answered.
 *
 * @param descriptor The descriptor to use
 * @param status     How the descriptor was obtained
 */
public record EnrichmentResult(
        OwnerDescriptor descriptor,
        Status status) {

    public enum Status {
        RESOLVED,
        NOT_FOUND,
        UNAVAILABLE,
        SKIPPED
    }

    public static EnrichmentResult resolved(OwnerDescriptor descriptor) {
        return new EnrichmentResult(descriptor, Status.RESOLVED);
    }

    public static EnrichmentResult fallback(OwnerDescriptor descriptor, Status status) {
        return new EnrichmentResult(descriptor, status);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
