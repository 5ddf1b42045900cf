package com.myinfra.deployments.ownership.exception;

/**
 * Raised when a resolver is called with an identity that cannot be resolved,
 * e.g. one without a user reference.
 */
public class InvalidIdentityException extends IllegalArgumentException {

    public InvalidIdentityException(String message) {
        super(message);
    }
}
