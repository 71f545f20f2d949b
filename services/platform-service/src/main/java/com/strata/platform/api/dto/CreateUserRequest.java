package com.strata.platform.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;

/**
 * @param status      {@code active} unless given
 * @param accessLevel {@code read_write} unless given
 */
public record CreateUserRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank String password,
        @NotBlank String role,
        UUID clientId,
        String status,
        String accessLevel) {}
