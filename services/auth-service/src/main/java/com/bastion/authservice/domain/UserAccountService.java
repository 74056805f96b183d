package com.bastion.authservice.domain;

import com.bastion.security.CredentialHasher;
import com.bastion.security.DuplicateEmailException;
import com.bastion.security.User;
import com.bastion.security.UserDirectory;
import com.bastion.security.UserField;
import com.bastion.security.UserFilter;
import com.bastion.security.UserNotFoundException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Account lifecycle on top of a {@link UserDirectory}: registration, password checks and the
 * reset-token flow. Passwords are only ever stored as {@link CredentialHasher} digests.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final UserDirectory userDirectory;
    private final CredentialHasher credentialHasher;

    public UserAccountService(UserDirectory userDirectory, CredentialHasher credentialHasher) {
        this.userDirectory = Objects.requireNonNull(userDirectory, "userDirectory");
        this.credentialHasher = Objects.requireNonNull(credentialHasher, "credentialHasher");
    }

    /**
     * Registers a new user.
     *
     * @throws DuplicateEmailException if the email is already registered
     * @throws IllegalArgumentException if email or password is blank
     */
    public User register(String email, String password) {
        requireText(email, "email");
        requireText(password, "password");
        if (userDirectory.findOne(UserFilter.byEmail(email)).isPresent()) {
            throw new DuplicateEmailException(email);
        }
        User user = userDirectory.insert(email, credentialHasher.hash(password));
        log.info("Registered user id={}", user.id());
        return user;
    }

    /**
     * Returns whether the email belongs to a user whose digest matches the password. Never throws
     * for unknown emails.
     */
    public boolean validLogin(String email, String password) {
        if (email == null || password == null || containsNul(email)) {
            return false;
        }
        return userDirectory.findOne(UserFilter.byEmail(email))
                .map(user -> credentialHasher.verify(password, user.passwordDigest()))
                .orElse(false);
    }

    /**
     * Generates and stores a fresh reset token for the user.
     *
     * @throws UserNotFoundException if no user has this email
     */
    public String issueResetToken(String email) {
        requireText(email, "email");
        User user = userDirectory.findOne(UserFilter.byEmail(email))
                .orElseThrow(() -> new UserNotFoundException("No user registered for this email"));
        String token = UUID.randomUUID().toString();
        userDirectory.update(user.id(), Map.of(UserField.RESET_TOKEN.fieldName(), token));
        log.info("Issued reset token for user id={}", user.id());
        return token;
    }

    /**
     * Replaces the password of the user holding the reset token and consumes the token.
     *
     * @throws UserNotFoundException if no user holds this token, or the holder has another email
     */
    public User updatePassword(String email, String resetToken, String newPassword) {
        requireText(email, "email");
        requireText(resetToken, "reset_token");
        requireText(newPassword, "password");
        User user = userDirectory.findOne(UserFilter.byResetToken(resetToken))
                .filter(holder -> holder.email().equals(email))
                .orElseThrow(() -> new UserNotFoundException("Reset token is not valid"));
        Map<String, Object> changes = new HashMap<>();
        changes.put(UserField.PASSWORD_DIGEST.fieldName(), credentialHasher.hash(newPassword));
        changes.put(UserField.RESET_TOKEN.fieldName(), null);
        userDirectory.update(user.id(), changes);
        log.info("Password updated for user id={}", user.id());
        return user;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (containsNul(value)) {
            throw new IllegalArgumentException(name + " must not contain NUL characters");
        }
    }

    private static boolean containsNul(String value) {
        return value.indexOf('\u0000') >= 0;
    }
}
