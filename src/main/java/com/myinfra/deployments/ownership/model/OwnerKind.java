package com.myinfra.deployments.ownership.model;

import java.util.Locale;

public enum OwnerKind {
    USER,
    GROUP;

    /**
     * Kind segment as written in catalog entity references.
     *
     * @return "User" or "Group"
     */
    public String entityKind() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
