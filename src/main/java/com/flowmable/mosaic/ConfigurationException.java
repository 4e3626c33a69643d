package com.flowmable.mosaic;

import java.util.List;

/**
 * The run cannot start (or continue) because of its configuration: missing or
 * invalid settings, missing directories, or a candidate pool that cannot
 * satisfy the requested mosaic.
 */
public class ConfigurationException extends MosaicException {

    private final List<String> problems;

    public ConfigurationException(String problem) {
        this(List.of(problem));
    }

    public ConfigurationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    /** Every problem found, in the order detected. */
    public List<String> problems() {
        return problems;
    }
}
