package com.bastion.authservice.config;

/**
 * Authentication scheme selected with {@code bastion.auth.type}.
 */
public enum AuthType {

    /** No authentication filter: every path is open. */
    NONE,

    /** Paths are protected but no identity ever resolves: protected paths are refused. */
    AUTH,

    /** HTTP Basic against the user store. */
    BASIC_AUTH
}
