package org.codenode.fbp.model;

import java.util.List;

/**
 * Raised at construction or validation time when a node, graph or runtime is configured inconsistently
 * (unsupported arity, malformed port mapping, connection to a missing port, ...). Never raised from inside
 * a running processing loop.
 */
public class FlowConfigurationException extends IllegalArgumentException {

    private final List<String> problems;

    public FlowConfigurationException(String message) {
        this(message, List.of(message));
    }

    public FlowConfigurationException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    /**
     * @return every individual problem that led to this exception.
     */
    public List<String> getProblems() {
        return problems;
    }
}
