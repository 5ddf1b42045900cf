package com.myinfra.deployments.ownership.model;

/**
 * Coarse access a user has on an application.
 * Declared from least to most privileged so that natural ordering follows privilege.
 */
public enum AccessLevel {
    NONE,
    LIMITED,
    FULL;

    public boolean isAtLeast(AccessLevel other) {
        return compareTo(other) >= 0;
    }
}
