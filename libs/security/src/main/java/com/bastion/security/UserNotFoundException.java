package com.bastion.security;

/**
 * Thrown when an operation targets a user that does not exist.
 */
public class UserNotFoundException extends UserDirectoryException {

    public UserNotFoundException(String message) {
        super(message);
    }

    public static UserNotFoundException forId(long id) {
        return new UserNotFoundException("No user with id " + id);
    }
}
