package com.myinfra.deployments.ownership.model;

/**
 * Subset of a catalog entity needed to label owners.
 */
public record CatalogEntity(
        String kind,
        String namespace,
        String name,
        String title) {

    /**
     * @param fallback Value used when the entity carries neither title nor name
     * @return the title, else the name, else the fallback
     */
    public String displayNameOr(String fallback) {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return fallback;
    }
}
