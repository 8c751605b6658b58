package com.dimensio.domain.extraction.rule;

/**
 * A rule or rule set is malformed. Raised while rule sets are loaded, never
 * while a document is parsed.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
