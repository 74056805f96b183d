package com.bastion.authservice.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/users}. */
public record RegistrationRequest(@NotBlank @Email String email, @NotBlank String password) {

    @Override
    public String toString() {
        return "RegistrationRequest[email=" + email + ", password=***]";
    }
}
