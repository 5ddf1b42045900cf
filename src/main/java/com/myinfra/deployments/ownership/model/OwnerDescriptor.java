package com.myinfra.deployments.ownership.model;

import java.util.Locale;

/**
 * Typed owner of an application.
 *
 * @param kind          USER or GROUP
 * @param canonicalName Owner name without kind and namespace (e.g., "platform-team")
 * @param displayName   Human readable name, defaults to the canonical name
 */
public record OwnerDescriptor(
        OwnerKind kind,
        String canonicalName,
        String displayName) {

    public static final String UNASSIGNED = "unassigned";

    /**
     * Owner recorded for applications that declare no owner at all.
     */
    public static OwnerDescriptor unassigned() {
        return new OwnerDescriptor(OwnerKind.GROUP, UNASSIGNED, "Unassigned");
    }

    public OwnerDescriptor withDisplayName(String newDisplayName) {
        return new OwnerDescriptor(kind, canonicalName, newDisplayName);
    }

    /**
     * Key identifying the owner independently of its display name (e.g., "group:platform-team").
     */
    public String ownerKey() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + canonicalName;
    }
}
