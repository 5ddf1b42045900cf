package com.myinfra.deployments.ownership.model;

/**
 * Owner declared as a structured reference.
 *
 * @param kind      Entity kind (e.g., "group"), optional
 * @param namespace Entity namespace, "default" when absent
 * @param name      Entity name
 */
public record StructuredOwner(
        String kind,
        String namespace,
        String name) implements OwnerField {

    private static final String DEFAULT_NAMESPACE = "default";

    @Override
    public String reference() {
        if (name == null || name.isBlank()) {
            return "";
        }
        // untyped structured owners follow the bare-name convention
        if (kind == null || kind.isBlank()) {
            return name.trim();
        }
        String ns = (namespace == null || namespace.isBlank()) ? DEFAULT_NAMESPACE : namespace.trim();
        return kind.trim() + ":" + ns + "/" + name.trim();
    }
}
