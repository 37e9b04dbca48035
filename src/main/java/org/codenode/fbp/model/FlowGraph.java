package org.codenode.fbp.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A complete flow: the top-level nodes, the connections between them and descriptive metadata.
 *
 * @param version semantic version of the flow definition (MAJOR.MINOR.PATCH with optional suffixes).
 */
public record FlowGraph(String id,
                        String name,
                        String version,
                        String description,
                        List<Node> rootNodes,
                        List<Connection> connections,
                        Map<String, String> metadata) {

    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9.-]+)?(\\+[a-zA-Z0-9.-]+)?$");

    public FlowGraph {
        if (id == null || id.isBlank()) {
            throw new FlowConfigurationException("FlowGraph ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new FlowConfigurationException("FlowGraph name cannot be blank");
        }
        if (version == null || !SEMVER.matcher(version).matches()) {
            throw new FlowConfigurationException("FlowGraph version must be valid semantic version (MAJOR.MINOR.PATCH), got: " + version);
        }
        rootNodes = List.copyOf(rootNodes);
        connections = List.copyOf(connections);
        metadata = Map.copyOf(metadata);
    }

    public static FlowGraph of(String id, String name, String version, List<Node> rootNodes, List<Connection> connections) {
        return new FlowGraph(id, name, version, null, rootNodes, connections, Map.of());
    }

    public FlowGraph withNodes(List<Node> nodes) {
        return new FlowGraph(id, name, version, description, nodes, connections, metadata);
    }

    public FlowGraph addNode(Node node) {
        List<Node> nodes = new ArrayList<>(rootNodes);
        nodes.add(node);
        return withNodes(nodes);
    }

    public FlowGraph removeNode(String nodeId) {
        return withNodes(rootNodes.stream().filter(n -> !n.id().equals(nodeId)).toList());
    }

    public FlowGraph withConnections(List<Connection> newConnections) {
        return new FlowGraph(id, name, version, description, rootNodes, newConnections, metadata);
    }

    public FlowGraph addConnection(Connection connection) {
        List<Connection> updated = new ArrayList<>(connections);
        updated.add(connection);
        return withConnections(updated);
    }

    public FlowGraph withMetadata(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new FlowGraph(id, name, version, description, rootNodes, connections, updated);
    }

    /**
     * @return every node in the graph, root nodes followed by their descendants, depth first.
     */
    public List<Node> getAllNodes() {
        List<Node> all = new ArrayList<>();
        for (Node node : rootNodes) {
            all.add(node);
            if (node instanceof GraphNode graphNode) {
                all.addAll(graphNode.getAllDescendants());
            }
        }
        return all;
    }

    public List<CodeNode> getAllCodeNodes() {
        List<CodeNode> result = new ArrayList<>();
        for (Node node : getAllNodes()) {
            if (node instanceof CodeNode codeNode) {
                result.add(codeNode);
            }
        }
        return result;
    }

    public Optional<Node> findNode(String nodeId) {
        return getAllNodes().stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public List<Connection> getConnectionsForNode(String nodeId) {
        return connections.stream().filter(c -> c.touches(nodeId)).toList();
    }

    /**
     * @return connections (top-level and internal to nested graph nodes) whose source is {@code nodeId}.
     */
    public List<Connection> getOutgoingConnections(String nodeId) {
        List<Connection> result = new ArrayList<>();
        for (Connection connection : allConnections()) {
            if (connection.sourceNodeId().equals(nodeId)) {
                result.add(connection);
            }
        }
        return result;
    }

    private List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>(connections);
        for (Node node : getAllNodes()) {
            if (node instanceof GraphNode graphNode) {
                all.addAll(graphNode.internalConnections());
            }
        }
        return all;
    }

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();

        for (Node node : rootNodes) {
            ValidationResult nodeResult = node.validate();
            if (!nodeResult.success()) {
                errors.add("Invalid root node '" + node.name() + "': " + nodeResult.errorMessage());
            }
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new HashSet<>();
        for (Node node : getAllNodes()) {
            if (!seen.add(node.id())) {
                duplicates.add(node.id());
            }
        }
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate node IDs found: " + String.join(", ", duplicates));
        }

        for (Connection connection : connections) {
            Optional<Node> source = findNode(connection.sourceNodeId());
            Optional<Node> target = findNode(connection.targetNodeId());
            if (source.isEmpty()) {
                errors.add("Connection '" + connection.id() + "' references non-existent source node '" + connection.sourceNodeId() + "'");
            }
            if (target.isEmpty()) {
                errors.add("Connection '" + connection.id() + "' references non-existent target node '" + connection.targetNodeId() + "'");
            }
            if (source.isEmpty() || target.isEmpty()) {
                errors.addAll(connection.validate().errors());
                continue;
            }
            Optional<Port> sourcePort = source.get().findPortById(connection.sourcePortId());
            Optional<Port> targetPort = target.get().findPortById(connection.targetPortId());
            if (sourcePort.isEmpty()) {
                errors.add("Connection '" + connection.id() + "' references non-existent source port '" + connection.sourcePortId() + "'");
            }
            if (targetPort.isEmpty()) {
                errors.add("Connection '" + connection.id() + "' references non-existent target port '" + connection.targetPortId() + "'");
            }
            if (sourcePort.isPresent() && targetPort.isPresent()) {
                errors.addAll(connection.validateWithPorts(sourcePort.get(), targetPort.get()).errors());
            } else {
                errors.addAll(connection.validate().errors());
            }
        }
        return ValidationResult.of(errors);
    }
}
