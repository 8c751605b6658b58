package com.dimensio.domain.extraction.model;

import com.dimensio.domain.extraction.model.value.ResolvedValue;

/**
 * One entry of the parse response.
 *
 * @param start     start offset in the document (inclusive)
 * @param end       end offset in the document (exclusive)
 * @param dimension dimension of the value
 * @param body      the covered text, exactly as it appears in the document
 * @param value     dimension-specific resolved value
 * @param latent    true if the value came from a low-confidence rule
 */
public record ResolvedSpan(
        int start,
        int end,
        Dimension<?> dimension,
        String body,
        ResolvedValue value,
        boolean latent
) {}
