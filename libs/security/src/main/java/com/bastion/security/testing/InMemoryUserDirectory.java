package com.bastion.security.testing;

import com.bastion.security.DuplicateEmailException;
import com.bastion.security.User;
import com.bastion.security.UserDirectory;
import com.bastion.security.UserField;
import com.bastion.security.UserFilter;
import com.bastion.security.UserNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link UserDirectory} kept in memory, for tests and local experiments.
 * <p>
 * Placed in the main source set so other modules can use it from their test scope via a
 * regular Maven dependency. All methods are synchronized.
 */
public final class InMemoryUserDirectory implements UserDirectory {

    private final Map<Long, User> users = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized List<User> lookup(UserFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        List<User> matches = new ArrayList<>();
        for (User user : users.values()) {
            if (filter.matches(user)) {
                matches.add(user);
            }
        }
        return List.copyOf(matches);
    }

    @Override
    public synchronized User insert(String email, String passwordDigest) {
        if (emailTaken(email, null)) {
            throw new DuplicateEmailException(email);
        }
        User user = new User(nextId++, email, passwordDigest, null, null);
        users.put(user.id(), user);
        return user;
    }

    @Override
    public synchronized void update(long id, Map<String, ?> fields) {
        Map<UserField, Object> resolved = new LinkedHashMap<>();
        fields.forEach((name, value) -> resolved.put(UserField.require(name), value));

        User current = users.get(id);
        if (current == null) {
            throw UserNotFoundException.forId(id);
        }
        String email = current.email();
        String digest = current.passwordDigest();
        String sessionToken = current.sessionToken();
        String resetToken = current.resetToken();
        for (Map.Entry<UserField, Object> entry : resolved.entrySet()) {
            String value = entry.getValue() == null ? null : entry.getValue().toString();
            switch (entry.getKey()) {
                case EMAIL -> email = value;
                case PASSWORD_DIGEST -> digest = value;
                case SESSION_TOKEN -> sessionToken = value;
                case RESET_TOKEN -> resetToken = value;
            }
        }
        if (email == null || digest == null) {
            throw new IllegalArgumentException("email and password_digest must not be null");
        }
        if (!email.equals(current.email()) && emailTaken(email, id)) {
            throw new DuplicateEmailException(email);
        }
        users.put(id, new User(id, email, digest, sessionToken, resetToken));
    }

    /**
     * Stores a user as given, bypassing the uniqueness check. Lets tests reproduce
     * stores whose email constraint was violated.
     */
    public synchronized User put(User user) {
        users.put(user.id(), user);
        nextId = Math.max(nextId, user.id() + 1);
        return user;
    }

    /**
     * Returns the number of stored users.
     */
    public synchronized int size() {
        return users.size();
    }

    private boolean emailTaken(String email, Long exceptId) {
        return users.values().stream()
                .anyMatch(u -> u.email().equals(email) && (exceptId == null || u.id() != exceptId));
    }
}
