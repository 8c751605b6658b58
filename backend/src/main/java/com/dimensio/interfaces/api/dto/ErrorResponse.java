package com.dimensio.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
