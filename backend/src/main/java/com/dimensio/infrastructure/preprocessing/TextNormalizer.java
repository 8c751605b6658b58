package com.dimensio.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Prepares input text for matching without moving any character:
 * - Invisible characters (zero-width spaces, soft hyphens, BOM) become spaces
 * - Non-breaking and other Unicode spaces become plain spaces
 * - Control characters other than \n, \r, \t and unpaired surrogates are rejected
 * <p>
 * Output has the input's length, so spans found in it index the caller's text.
 * </p>
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // No-break and typographic spaces
    private static final Pattern UNICODE_SPACES = Pattern.compile(
            "[\\u00A0\\u2000-\\u200A\\u202F\\u205F\\u3000]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    /**
     * @param text raw caller input
     * @return text of the same length, ready for matching
     * @throws MalformedInputTextException on control characters or unpaired surrogates
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Reject what cannot be valid text
        if (CONTROL_CHARS.matcher(text).find()) {
            throw new MalformedInputTextException("Text contains control characters");
        }
        int unpaired = firstUnpairedSurrogate(text);
        if (unpaired >= 0) {
            throw new MalformedInputTextException("Text contains an unpaired surrogate at offset " + unpaired);
        }

        // 2. Invisible characters → space
        String result = INVISIBLE_CHARS.matcher(text).replaceAll(" ");

        // 3. Unicode spaces → space
        result = UNICODE_SPACES.matcher(result).replaceAll(" ");

        return result;
    }

    private static int firstUnpairedSurrogate(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                    i++;
                    continue;
                }
                return i;
            }
            if (Character.isLowSurrogate(c)) {
                return i;
            }
        }
        return -1;
    }
}
