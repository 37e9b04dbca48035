package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A composite node containing child nodes, the connections between them, and exposed ports that pass
 * through to ports of its children.
 *
 * @param portMappings exposed port name to the child port it stands for.
 */
public record GraphNode(String id,
                        String name,
                        String description,
                        List<Node> childNodes,
                        List<Connection> internalConnections,
                        List<Port> inputPorts,
                        List<Port> outputPorts,
                        Map<String, PortMapping> portMappings,
                        ControlConfig controlConfig,
                        ExecutionState executionState) implements Node {

    /**
     * Target of an exposed port.
     */
    public record PortMapping(String childNodeId, String childPortName) {
        public PortMapping {
            Objects.requireNonNull(childNodeId, "childNodeId");
            Objects.requireNonNull(childPortName, "childPortName");
        }
    }

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        childNodes = List.copyOf(childNodes);
        internalConnections = List.copyOf(internalConnections);
        inputPorts = List.copyOf(inputPorts);
        outputPorts = List.copyOf(outputPorts);
        portMappings = Map.copyOf(portMappings);
        controlConfig = controlConfig == null ? ControlConfig.defaults() : controlConfig;
        executionState = executionState == null ? ExecutionState.IDLE : executionState;
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    @Override
    public GraphNode withExecutionState(ExecutionState newState, boolean propagate) {
        List<Node> children = propagate ? propagateStateToChildren(newState) : childNodes;
        return new GraphNode(id, name, description, children, internalConnections, inputPorts, outputPorts,
                portMappings, controlConfig, newState);
    }

    /**
     * Applies {@code newState} to every child that is not independently controlled, recursing into nested
     * graph nodes. Independent children keep their state and so does their whole subtree.
     */
    public List<Node> propagateStateToChildren(ExecutionState newState) {
        List<Node> updated = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            updated.add(child.isIndependent() ? child : child.withExecutionState(newState, true));
        }
        return updated;
    }

    @Override
    public GraphNode withControlConfig(ControlConfig newConfig, boolean propagate) {
        List<Node> children = propagate ? propagateConfigToChildren(newConfig) : childNodes;
        return new GraphNode(id, name, description, children, internalConnections, inputPorts, outputPorts,
                portMappings, newConfig, executionState);
    }

    public List<Node> propagateConfigToChildren(ControlConfig newConfig) {
        List<Node> updated = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            if (child.isIndependent()) {
                updated.add(child);
            } else {
                updated.add(child.withControlConfig(newConfig.withIndependentControl(false), true));
            }
        }
        return updated;
    }

    public GraphNode withChildren(List<Node> children) {
        return new GraphNode(id, name, description, children, internalConnections, inputPorts, outputPorts,
                portMappings, controlConfig, executionState);
    }

    public GraphNode withConnections(List<Connection> connections) {
        return new GraphNode(id, name, description, childNodes, connections, inputPorts, outputPorts,
                portMappings, controlConfig, executionState);
    }

    public GraphNode withPortMapping(String exposedPortName, PortMapping mapping) {
        Map<String, PortMapping> mappings = new LinkedHashMap<>(portMappings);
        mappings.put(exposedPortName, mapping);
        return new GraphNode(id, name, description, childNodes, internalConnections, inputPorts, outputPorts,
                mappings, controlConfig, executionState);
    }

    /**
     * @return all nodes below this one, depth first, in child order.
     */
    public List<Node> getAllDescendants() {
        List<Node> descendants = new ArrayList<>();
        for (Node child : childNodes) {
            descendants.add(child);
            if (child instanceof GraphNode nested) {
                descendants.addAll(nested.getAllDescendants());
            }
        }
        return descendants;
    }

    public List<CodeNode> getAllCodeNodes() {
        List<CodeNode> result = new ArrayList<>();
        for (Node node : getAllDescendants()) {
            if (node instanceof CodeNode codeNode) {
                result.add(codeNode);
            }
        }
        return result;
    }

    public Optional<Node> findChild(String childId) {
        return childNodes.stream().filter(c -> c.id().equals(childId)).findFirst();
    }

    public Optional<Node> findDescendant(String nodeId) {
        return getAllDescendants().stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public int getMaxDepth() {
        int deepest = 0;
        for (Node child : childNodes) {
            if (child instanceof GraphNode nested) {
                deepest = Math.max(deepest, nested.getMaxDepth());
            }
        }
        return childNodes.isEmpty() ? 0 : deepest + 1;
    }

    @Override
    public ValidationResult validate() {
        List<String> errors = Node.validateCommon(this);

        if (childNodes.isEmpty()) {
            errors.add("GraphNode '" + name + "' must have at least one child node");
        }
        Set<String> childIds = new HashSet<>();
        for (Node child : childNodes) {
            if (!childIds.add(child.id())) {
                errors.add("GraphNode '" + name + "' contains duplicate child id '" + child.id() + "'");
            }
            ValidationResult childResult = child.validate();
            if (!childResult.success()) {
                errors.add("Invalid child node '" + child.name() + "': " + childResult.errorMessage());
            }
        }
        if (getAllDescendants().stream().anyMatch(n -> n.id().equals(id))) {
            errors.add("Circular containment detected: GraphNode '" + name + "' appears in its own descendant tree");
        }

        validatePortMappings(errors);
        validateInternalConnections(errors);
        return ValidationResult.of(errors);
    }

    private void validatePortMappings(List<String> errors) {
        for (Port exposed : allPorts()) {
            PortMapping mapping = portMappings.get(exposed.name());
            if (mapping == null) {
                errors.add("GraphNode port '" + exposed.name() + "' has no mapping to child node port");
                continue;
            }
            Optional<Node> child = findChild(mapping.childNodeId());
            if (child.isEmpty()) {
                errors.add("Port mapping '" + exposed.name() + "' references non-existent child node '" + mapping.childNodeId() + "'");
                continue;
            }
            Optional<Port> childPort = child.get().findPort(mapping.childPortName());
            if (childPort.isEmpty()) {
                errors.add(String.format("Port mapping '%s' references non-existent port '%s' on child node '%s'",
                        exposed.name(), mapping.childPortName(), mapping.childNodeId()));
                continue;
            }
            Port target = childPort.get();
            if (target.direction() != exposed.direction()) {
                errors.add(String.format("Port mapping '%s' joins a %s port to a %s child port",
                        exposed.name(), exposed.direction(), target.direction()));
            } else if (exposed.isInput() ? !Port.typesCompatible(exposed.dataType(), target.dataType())
                                         : !Port.typesCompatible(target.dataType(), exposed.dataType())) {
                errors.add(String.format("Port mapping '%s' type %s is incompatible with child port '%s' type %s",
                        exposed.name(), exposed.typeName(), target.name(), target.typeName()));
            }
        }
        for (String mapped : portMappings.keySet()) {
            if (findPort(mapped).isEmpty()) {
                errors.add("Port mapping '" + mapped + "' does not correspond to an exposed port");
            }
        }
    }

    private void validateInternalConnections(List<String> errors) {
        for (Connection connection : internalConnections) {
            Optional<Node> source = findChild(connection.sourceNodeId());
            Optional<Node> target = findChild(connection.targetNodeId());
            if (source.isEmpty()) {
                errors.add("Internal connection '" + connection.id() + "' has source node '" + connection.sourceNodeId() + "' that is not a child of this GraphNode");
            }
            if (target.isEmpty()) {
                errors.add("Internal connection '" + connection.id() + "' has target node '" + connection.targetNodeId() + "' that is not a child of this GraphNode");
            }
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            Optional<Port> sourcePort = source.get().findPortById(connection.sourcePortId());
            Optional<Port> targetPort = target.get().findPortById(connection.targetPortId());
            if (sourcePort.isEmpty() || targetPort.isEmpty()) {
                errors.add("Internal connection '" + connection.id() + "' references a port that does not exist");
                continue;
            }
            errors.addAll(connection.validateWithPorts(sourcePort.get(), targetPort.get()).errors());
        }
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private String description;
        private final List<Node> childNodes = new ArrayList<>();
        private final List<Connection> internalConnections = new ArrayList<>();
        private final List<Port> inputPorts = new ArrayList<>();
        private final List<Port> outputPorts = new ArrayList<>();
        private final Map<String, PortMapping> portMappings = new LinkedHashMap<>();
        private ControlConfig controlConfig = ControlConfig.defaults();
        private ExecutionState executionState = ExecutionState.IDLE;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder child(Node child) {
            childNodes.add(child);
            return this;
        }

        public Builder connection(Connection connection) {
            internalConnections.add(connection);
            return this;
        }

        /**
         * Exposes {@code childPortName} of {@code childNodeId} as an input port of this graph node.
         */
        public Builder exposeInput(String portName, Class<?> dataType, String childNodeId, String childPortName) {
            inputPorts.add(Port.input(id, portName, dataType));
            portMappings.put(portName, new PortMapping(childNodeId, childPortName));
            return this;
        }

        public Builder exposeOutput(String portName, Class<?> dataType, String childNodeId, String childPortName) {
            outputPorts.add(Port.output(id, portName, dataType));
            portMappings.put(portName, new PortMapping(childNodeId, childPortName));
            return this;
        }

        public Builder controlConfig(ControlConfig controlConfig) {
            this.controlConfig = controlConfig;
            return this;
        }

        public Builder executionState(ExecutionState executionState) {
            this.executionState = executionState;
            return this;
        }

        public GraphNode build() {
            return new GraphNode(id, name, description, childNodes, internalConnections, inputPorts, outputPorts,
                    portMappings, controlConfig, executionState);
        }
    }
}
