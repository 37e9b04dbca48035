package org.codenode.fbp.runtime;

import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.Connection;
import org.codenode.fbp.model.ControlConfig;
import org.codenode.fbp.model.FlowConfigurationException;
import org.codenode.fbp.model.FlowGraph;
import org.codenode.fbp.model.Node;
import org.codenode.fbp.model.Port;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes the node a runtime is created for: either an existing {@link CodeNode}, or a name from which
 * a node with generic ports is built. Output channel capacities that are not set fall back to
 * {@link RuntimeSettings#defaultChannelCapacity()}.
 * <p>
 * Instances are immutable; every {@code with} style method returns a copy.
 */
public final class NodeOptions {

    private final String name;
    private final String description;
    private final ControlConfig controlConfig;
    private final List<Integer> outputCapacities;
    private final CodeNode codeNode;

    private NodeOptions(String name, String description, ControlConfig controlConfig,
                        List<Integer> outputCapacities, CodeNode codeNode) {
        this.name = name;
        this.description = description;
        this.controlConfig = controlConfig;
        this.outputCapacities = Collections.unmodifiableList(new ArrayList<>(outputCapacities));
        this.codeNode = codeNode;
    }

    public static NodeOptions named(String name) {
        if (name == null || name.isBlank()) {
            throw new FlowConfigurationException("Node name must not be blank");
        }
        return new NodeOptions(name, null, null, List.of(), null);
    }

    /**
     * Uses an existing model node. Its port counts must match the runtime shape it is used with.
     */
    public static NodeOptions forNode(CodeNode codeNode) {
        Objects.requireNonNull(codeNode, "codeNode");
        return new NodeOptions(codeNode.name(), codeNode.description(), null, List.of(), codeNode);
    }

    /**
     * Takes the node from a flow graph and the capacity of each output from the connection leaving it.
     * Outputs without a connection use the default capacity.
     *
     * @throws FlowConfigurationException if the id is unknown, does not denote a {@link CodeNode}, or an
     *                                    outgoing connection has an invalid capacity.
     */
    public static NodeOptions fromGraph(FlowGraph graph, String nodeId) {
        Node node = graph.findNode(nodeId)
            .orElseThrow(() -> new FlowConfigurationException("Flow graph '" + graph.id() + "' has no node '" + nodeId + "'"));
        if (!(node instanceof CodeNode codeNode)) {
            throw new FlowConfigurationException("Node '" + nodeId + "' is a graph node and cannot be executed directly");
        }
        List<Connection> outgoing = graph.getOutgoingConnections(nodeId);
        List<Integer> capacities = new ArrayList<>();
        for (Port port : codeNode.outputPorts()) {
            Integer capacity = outgoing.stream()
                .filter(c -> c.sourcePortId().equals(port.id()))
                .map(Connection::channelCapacity)
                .findFirst()
                .orElse(null);
            if (capacity != null && capacity < Connection.UNLIMITED) {
                throw new FlowConfigurationException("Invalid channel capacity " + capacity + " on output '"
                    + port.name() + "' of node '" + nodeId + "'");
            }
            capacities.add(capacity);
        }
        return new NodeOptions(codeNode.name(), codeNode.description(), null, capacities, codeNode);
    }

    public NodeOptions description(String newDescription) {
        return new NodeOptions(name, newDescription, controlConfig, outputCapacities, codeNode);
    }

    public NodeOptions controlConfig(ControlConfig newConfig) {
        return new NodeOptions(name, description, Objects.requireNonNull(newConfig, "controlConfig"), outputCapacities, codeNode);
    }

    public NodeOptions independent() {
        ControlConfig base = controlConfig != null ? controlConfig
            : codeNode != null ? codeNode.controlConfig() : ControlConfig.defaults();
        return controlConfig(base.withIndependentControl(true));
    }

    /**
     * @param capacities One capacity per output, in output order. {@code 0} is a rendezvous channel,
     *                   {@code -1} unbounded.
     */
    public NodeOptions outputCapacities(int... capacities) {
        List<Integer> list = new ArrayList<>();
        for (int capacity : capacities) {
            if (capacity < Connection.UNLIMITED) {
                throw new FlowConfigurationException("Invalid channel capacity " + capacity + " for node '" + name + "'");
            }
            list.add(capacity);
        }
        return new NodeOptions(name, description, controlConfig, list, codeNode);
    }

    public String getName() {
        return name;
    }

    int outputCapacity(int index, int defaultCapacity) {
        if (index < outputCapacities.size() && outputCapacities.get(index) != null) {
            return outputCapacities.get(index);
        }
        return defaultCapacity;
    }

    /**
     * Returns the node for a runtime with the given arity, building one with generic ports if none was given.
     *
     * @throws FlowConfigurationException if a supplied node's port counts do not match.
     */
    CodeNode resolveNode(int inputCount, int outputCount) {
        if (codeNode != null) {
            if (codeNode.inputPorts().size() != inputCount || codeNode.outputPorts().size() != outputCount) {
                throw new FlowConfigurationException(String.format(
                    "Node '%s' has %d inputs and %d outputs, but the runtime needs %d inputs and %d outputs",
                    codeNode.id(), codeNode.inputPorts().size(), codeNode.outputPorts().size(), inputCount, outputCount),
                    List.of("port count mismatch"));
            }
            return controlConfig == null ? codeNode : codeNode.withControlConfig(controlConfig);
        }
        CodeNode.Builder builder = CodeNode.builder(CodeNode.generateId(name.replaceAll("\\s+", "_")), name)
            .description(description)
            .controlConfig(controlConfig == null ? ControlConfig.defaults() : controlConfig);
        for (String port : portNames("input", inputCount)) {
            builder.input(port, Object.class);
        }
        for (String port : portNames("output", outputCount)) {
            builder.output(port, Object.class);
        }
        return builder.build();
    }

    private static List<String> portNames(String prefix, int count) {
        if (count == 1) {
            return List.of(prefix);
        }
        String[] names = new String[count];
        for (int i = 0; i < count; i++) {
            names[i] = prefix + (i + 1);
        }
        return Arrays.asList(names);
    }

    @Override
    public String toString() {
        return "NodeOptions[" + name + "]";
    }
}
