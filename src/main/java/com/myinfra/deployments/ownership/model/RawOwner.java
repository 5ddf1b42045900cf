package com.myinfra.deployments.ownership.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Owner declared as a reference string (e.g., "group:default/platform-team" or "platform-team").
 */
public record RawOwner(@JsonValue String value) implements OwnerField {

    @Override
    public String reference() {
        return value == null ? "" : value.trim();
    }
}
