package com.myinfra.deployments.ownership.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Owner as declared on a catalog application. The catalog allows either a plain
 * reference string or a structured reference; both normalize to a single string.
 */
@JsonDeserialize(using = OwnerFieldDeserializer.class)
public sealed interface OwnerField permits RawOwner, StructuredOwner {

    /**
     * @return the owner reference string, possibly blank
     */
    String reference();
}
