/**
 * Account lifecycle rules: registration, login checks and password resets.
 *
 * <p>Depends only on the {@code com.bastion.security} contracts, never on the api or
 * infrastructure packages.
 */
package com.bastion.authservice.domain;
