package com.dimensio.interfaces.api.dto;

import java.util.Map;
import java.util.Set;

public record LocalesResponse(
        Map<String, Set<String>> locales,
        int maxTextLength
) {}
