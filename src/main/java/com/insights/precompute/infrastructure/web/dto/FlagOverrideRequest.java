package com.insights.precompute.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;

public record FlagOverrideRequest(
        @NotNull Boolean enabled
) {}
