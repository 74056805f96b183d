package com.bastion.security;

/**
 * Thrown when lookup criteria are malformed. Surfaced to the caller, never swallowed.
 */
public class InvalidQueryException extends UserDirectoryException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
