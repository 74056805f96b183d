package com.bastion.security;

import java.util.Collection;

/**
 * Decides whether a request path needs authentication, given a set of exemption rules.
 * <p>
 * A rule is either an exact path or a prefix ending in {@value #WILDCARD}. Paths are compared
 * with a single trailing slash, so {@code /api/v1/status} and {@code /api/v1/status/} are the same.
 * Any matching rule exempts the path; the order of rules does not matter.
 */
public final class PathAuthorizationPolicy {

    /** Trailing marker that turns a rule into a prefix match. */
    public static final char WILDCARD = '*';

    private static final char SEPARATOR = '/';

    private PathAuthorizationPolicy() {
        // utility class
    }

    /**
     * Returns false only if some rule exempts the path. Missing path or rules fail closed.
     *
     * @param path       the request path (may be null)
     * @param exemptions exemption rules (may be null; null rules are ignored)
     * @return true if authentication is required
     */
    public static boolean requiresAuth(String path, Collection<String> exemptions) {
        if (path == null || path.isEmpty() || exemptions == null || exemptions.isEmpty()) {
            return true;
        }
        String normalized = normalize(path);
        for (String rule : exemptions) {
            if (rule != null && matches(normalized, rule)) {
                return false;
            }
        }
        return true;
    }

    static String normalize(String path) {
        return path.charAt(path.length() - 1) == SEPARATOR ? path : path + SEPARATOR;
    }

    private static boolean matches(String normalizedPath, String rule) {
        if (!rule.isEmpty() && rule.charAt(rule.length() - 1) == WILDCARD) {
            String prefix = rule.substring(0, rule.length() - 1);
            return normalizedPath.startsWith(prefix) || normalizedPath.equals(rule);
        }
        return normalizedPath.equals(rule);
    }
}
