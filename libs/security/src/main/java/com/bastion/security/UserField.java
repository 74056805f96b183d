package com.bastion.security;

import java.util.Optional;

/**
 * Fields of a {@link User} that {@link UserDirectory#update(long, java.util.Map)} may change.
 * <p>
 * Each constant carries the field name callers use and the column it is stored in.
 * The id is assigned by the directory and is not updatable.
 */
public enum UserField {

    EMAIL("email", "email"),
    PASSWORD_DIGEST("password_digest", "hashed_password"),
    SESSION_TOKEN("session_token", "session_id"),
    RESET_TOKEN("reset_token", "reset_token");

    private final String fieldName;
    private final String column;

    UserField(String fieldName, String column) {
        this.fieldName = fieldName;
        this.column = column;
    }

    /** Name used in update requests (e.g., "reset_token"). */
    public String fieldName() {
        return fieldName;
    }

    /** Column backing this field in the users table. */
    public String column() {
        return column;
    }

    /**
     * Looks up a field by its name.
     *
     * @param fieldName the name to match (case-sensitive)
     * @return the matching field, or empty if the name is not part of the schema
     */
    public static Optional<UserField> fromName(String fieldName) {
        for (UserField field : values()) {
            if (field.fieldName.equals(fieldName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a field name, failing for names outside the schema.
     *
     * @throws UnknownFieldException if the name is not an updatable field
     */
    public static UserField require(String fieldName) {
        return fromName(fieldName).orElseThrow(() -> new UnknownFieldException(fieldName));
    }
}
