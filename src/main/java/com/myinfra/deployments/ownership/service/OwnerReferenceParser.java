package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import com.myinfra.deployments.ownership.model.OwnerKind;
import org.springframework.stereotype.Component;

/**
 * Turns owner reference strings into typed owners.
 *
 * <p>Accepted forms: "user:default/alice", "group:default/platform-team",
 * "Group:platform-team", "platform-team". Only an explicit "user" kind yields a
 * user owner; every other kind, and a bare name, is a group.
 */
@Component
public class OwnerReferenceParser {

    /**
     * Parses a non-empty owner reference. Never fails.
     *
     * @param raw Owner reference as declared on the application
     * @return the owner, display name equal to the canonical name
     */
    public OwnerDescriptor parse(String raw) {
        int colon = raw.indexOf(':');
        if (colon < 0) {
            return new OwnerDescriptor(OwnerKind.GROUP, raw, raw);
        }

        String kindToken = raw.substring(0, colon);
        OwnerKind kind = "user".equalsIgnoreCase(kindToken) ? OwnerKind.USER : OwnerKind.GROUP;
        String name = nameOf(raw.substring(colon + 1));

        return new OwnerDescriptor(kind, name, name);
    }

    /**
     * @param ref Reference, optionally namespaced
     * @return the segment after the last '/', or the whole reference
     */
    public static String nameOf(String ref) {
        int slash = ref.lastIndexOf('/');
        return slash < 0 ? ref : ref.substring(slash + 1);
    }
}
