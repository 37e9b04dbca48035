package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A unit of a flow graph: either a leaf {@link CodeNode} or a composite {@link GraphNode}.
 * <p>
 * Nodes are immutable values. Every {@code with...} method returns a changed copy.
 */
public sealed interface Node permits CodeNode, GraphNode {

    String id();

    String name();

    String description();

    List<Port> inputPorts();

    List<Port> outputPorts();

    /**
     * The resting execution state, used before execution starts or after it fully stops.
     */
    ExecutionState executionState();

    ControlConfig controlConfig();

    /**
     * Returns a copy with the given resting state. For a {@link GraphNode} with {@code propagate} set, the
     * state is also applied to every descendant that does not have {@code independentControl}.
     */
    Node withExecutionState(ExecutionState newState, boolean propagate);

    /**
     * Returns a copy with the given control configuration. For a {@link GraphNode} with {@code propagate}
     * set, the configuration is pushed to every non-independent descendant, keeping the descendant's own
     * {@code independentControl} flag.
     */
    Node withControlConfig(ControlConfig newConfig, boolean propagate);

    ValidationResult validate();

    default List<Port> allPorts() {
        return Stream.concat(inputPorts().stream(), outputPorts().stream()).toList();
    }

    default Optional<Port> findPort(String portName) {
        return allPorts().stream().filter(p -> p.name().equals(portName)).findFirst();
    }

    default Optional<Port> findPortById(String portId) {
        return allPorts().stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    default boolean isIndependent() {
        return controlConfig().independentControl();
    }

    /**
     * Validation shared by both node kinds: identity, port ownership and port uniqueness.
     */
    static List<String> validateCommon(Node node) {
        List<String> errors = new ArrayList<>();
        if (node.id().isBlank()) {
            errors.add("Node ID cannot be blank");
        }
        if (node.name().isBlank()) {
            errors.add("Node name cannot be blank");
        }
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (Port port : node.allPorts()) {
            errors.addAll(port.validate().errors());
            if (!port.owningNodeId().equals(node.id())) {
                errors.add(String.format("Port '%s' has incorrect owningNodeId: expected '%s', got '%s'",
                        port.name(), node.id(), port.owningNodeId()));
            }
            if (!ids.add(port.id())) {
                errors.add("Duplicate port id '" + port.id() + "' on node '" + node.name() + "'");
            }
            if (!names.add(port.name())) {
                errors.add("Duplicate port name '" + port.name() + "' on node '" + node.name() + "'");
            }
        }
        for (Port port : node.inputPorts()) {
            if (!port.isInput()) {
                errors.add("Port '" + port.name() + "' is listed as input but has direction " + port.direction());
            }
        }
        for (Port port : node.outputPorts()) {
            if (!port.isOutput()) {
                errors.add("Port '" + port.name() + "' is listed as output but has direction " + port.direction());
            }
        }
        return errors;
    }
}
