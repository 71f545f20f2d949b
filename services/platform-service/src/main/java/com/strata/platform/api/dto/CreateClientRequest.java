package com.strata.platform.api.dto;

import com.strata.platform.domain.TenantType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateClientRequest(
        @NotBlank @Size(max = 255) String name, @NotNull TenantType clientType, Long contractDurationDays) {}
