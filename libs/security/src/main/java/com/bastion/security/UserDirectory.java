package com.bastion.security;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store of {@link User} records.
 * <p>
 * Email is unique across the directory. Implementations must be safe for concurrent reads,
 * and each {@link #update} applies to exactly one record atomically.
 */
public interface UserDirectory {

    /**
     * Returns the users matching every criterion of the filter, in id order.
     * An empty list means no user matched.
     *
     * @throws InvalidQueryException if the filter cannot be evaluated
     */
    List<User> lookup(UserFilter filter);

    /**
     * Returns the first user matching the filter.
     */
    default Optional<User> findOne(UserFilter filter) {
        return lookup(filter).stream().findFirst();
    }

    /**
     * Adds a user.
     *
     * @param email          the login email
     * @param passwordDigest digest produced by a {@link CredentialHasher}
     * @return the stored user with its assigned id
     * @throws DuplicateEmailException if a user with this email already exists
     */
    User insert(String email, String passwordDigest);

    /**
     * Changes fields of one user. Keys are {@link UserField} names; values are strings or null.
     *
     * @param id     the user to change
     * @param fields field name to new value
     * @throws UnknownFieldException  if a key is not an updatable field
     * @throws UserNotFoundException  if no user has this id
     * @throws DuplicateEmailException if an email change collides with another user
     */
    void update(long id, Map<String, ?> fields);
}
