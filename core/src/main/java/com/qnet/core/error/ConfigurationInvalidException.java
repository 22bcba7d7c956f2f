package com.qnet.core.error;

import java.util.List;

/**
 * Thrown when a configuration object fails validation at startup or on update.
 */
public class ConfigurationInvalidException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationInvalidException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
