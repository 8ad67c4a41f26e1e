package com.coresidency.core.config;

import java.util.List;

/**
 * Raised when a configuration source cannot be read, is not valid JSON/YAML,
 * misses required keys or carries values of the wrong type or range.
 *
 * <p>
 * A reload that fails with this exception never replaces the active
 * configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class MalformedConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public MalformedConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public MalformedConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    /**
     * @param problems every validation problem found; must not be empty
     */
    public MalformedConfigurationException(List<String> problems) {
        super("Configuration validation failed:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return the individual problems, in the order they were found
     */
    public List<String> getProblems() {
        return problems;
    }
}
