package com.bastion.authservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/reset_password}. */
public record ResetTokenRequest(@NotBlank String email) {}
