package com.dimensio.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;

public record ParseRequest(
        @NotNull(message = "Text is required")
        String text,

        @NotBlank(message = "Locale is required")
        @Size(max = 20, message = "Locale must not exceed 20 characters")
        String locale,

        OffsetDateTime referenceTime,

        @Size(max = 64, message = "Zone must not exceed 64 characters")
        String zone,

        @Size(max = 20, message = "At most 20 dimensions can be requested")
        List<String> dims
) {}
