package com.bastion.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /api/v1/reset_password}. */
public record PasswordUpdateRequest(
        @NotBlank String email,
        @NotBlank @JsonProperty("reset_token") String resetToken,
        @NotBlank @JsonProperty("new_password") String newPassword) {

    @Override
    public String toString() {
        return "PasswordUpdateRequest[email=" + email + ", resetToken=***, newPassword=***]";
    }
}
