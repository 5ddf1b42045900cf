package com.myinfra.deployments.ownership.model;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Catalog application as handed over by the catalog. Never mutated here.
 *
 * @param name        Unique application name
 * @param owner       Declared owner, may be null
 * @param annotations Catalog annotations (e.g., "github.com/project-slug")
 */
public record Application(
        String name,
        OwnerField owner,
        Map<String, String> annotations) {

    public Application {
        annotations = annotations == null
                ? Map.of()
                : annotations.entrySet().stream()
                        .filter(e -> e.getKey() != null && e.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static Application of(String name, String owner) {
        return new Application(name, owner == null ? null : new RawOwner(owner), Map.of());
    }

    /**
     * @return the normalized owner reference, empty when no owner is declared
     */
    public Optional<String> ownerReference() {
        if (owner == null) {
            return Optional.empty();
        }
        String reference = owner.reference();
        return reference.isBlank() ? Optional.empty() : Optional.of(reference);
    }

    public Optional<String> annotation(String key) {
        String value = annotations.get(key);
        return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value);
    }
}
