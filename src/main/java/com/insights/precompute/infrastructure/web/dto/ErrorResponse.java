package com.insights.precompute.infrastructure.web.dto;

public record ErrorResponse(
        String error,
        String message
) {}
