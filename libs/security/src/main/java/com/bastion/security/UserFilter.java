package com.bastion.security;

import java.util.Map;

/**
 * Criteria for {@link UserDirectory#lookup(UserFilter)}. All criteria that are set must match.
 * <p>
 * At least one criterion is required; a filter that selects nothing specific is an invalid
 * query rather than "all users".
 *
 * @param email      exact email to match (nullable)
 * @param id         exact id to match (nullable)
 * @param resetToken exact reset token to match (nullable)
 */
public record UserFilter(String email, Long id, String resetToken) {

    public static final String KEY_EMAIL = "email";
    public static final String KEY_ID = "id";
    public static final String KEY_RESET_TOKEN = "reset_token";

    public UserFilter {
        if (email == null && id == null && resetToken == null) {
            throw new InvalidQueryException("filter must specify at least one of email, id, reset_token");
        }
    }

    public static UserFilter byEmail(String email) {
        return new UserFilter(email, null, null);
    }

    public static UserFilter byId(long id) {
        return new UserFilter(null, id, null);
    }

    public static UserFilter byResetToken(String resetToken) {
        return new UserFilter(null, null, resetToken);
    }

    /**
     * Builds a filter from free-form criteria, e.g. request parameters.
     *
     * @param criteria keys {@value #KEY_EMAIL}, {@value #KEY_ID}, {@value #KEY_RESET_TOKEN}
     * @return the filter
     * @throws InvalidQueryException for unknown keys, mistyped values, or no criteria
     */
    public static UserFilter of(Map<String, ?> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            throw new InvalidQueryException("filter must specify at least one of email, id, reset_token");
        }
        String email = null;
        Long id = null;
        String resetToken = null;
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            Object value = entry.getValue();
            switch (String.valueOf(entry.getKey())) {
                case KEY_EMAIL -> email = requireString(KEY_EMAIL, value);
                case KEY_ID -> {
                    if (!(value instanceof Number number)) {
                        throw new InvalidQueryException("filter key 'id' must be a number");
                    }
                    id = number.longValue();
                }
                case KEY_RESET_TOKEN -> resetToken = requireString(KEY_RESET_TOKEN, value);
                default -> throw new InvalidQueryException("unknown filter key '" + entry.getKey() + "'");
            }
        }
        return new UserFilter(email, id, resetToken);
    }

    /**
     * Returns whether the given user satisfies every criterion of this filter.
     */
    public boolean matches(User user) {
        return (email == null || email.equals(user.email()))
                && (id == null || id == user.id())
                && (resetToken == null || resetToken.equals(user.resetToken()));
    }

    private static String requireString(String key, Object value) {
        if (!(value instanceof String s)) {
            throw new InvalidQueryException("filter key '" + key + "' must be a string");
        }
        return s;
    }
}
