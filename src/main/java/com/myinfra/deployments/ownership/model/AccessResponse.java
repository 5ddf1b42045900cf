package com.myinfra.deployments.ownership.model;

/**
 * @param application Application name
 * @param accessLevel Access the caller has on it
 */
public record AccessResponse(
        String application,
        AccessLevel accessLevel) {
}
