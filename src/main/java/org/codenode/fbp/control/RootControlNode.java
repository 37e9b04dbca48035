package org.codenode.fbp.control;

import org.codenode.fbp.model.ControlConfig;
import org.codenode.fbp.model.ExecutionState;
import org.codenode.fbp.model.FlowExecutionStatus;
import org.codenode.fbp.model.FlowGraph;
import org.codenode.fbp.model.GraphNode;
import org.codenode.fbp.model.Node;
import org.codenode.fbp.runtime.RuntimeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Coordinates flow-wide control of a {@link FlowGraph} and the runtimes executing it.
 * <p>
 * Every bulk method does two things: it returns a new graph whose nodes carry the new resting
 * {@link ExecutionState} (propagated into nested graph nodes, skipping nodes with
 * {@code independentControl}), and it forwards the command to the {@link RuntimeRegistry}, if any,
 * so that live runtimes change state too. The controller itself is immutable: use
 * {@link #withFlowGraph(FlowGraph)} to continue with the returned graph.
 */
public final class RootControlNode {

    private static final Logger log = LoggerFactory.getLogger(RootControlNode.class);

    private final String id;
    private final String name;
    private final FlowGraph flowGraph;
    private final RuntimeRegistry registry;
    private final long createdAt;

    private RootControlNode(String id, String name, FlowGraph flowGraph, RuntimeRegistry registry, long createdAt) {
        this.id = id;
        this.name = name;
        this.flowGraph = Objects.requireNonNull(flowGraph, "flowGraph");
        this.registry = registry;
        this.createdAt = createdAt;
    }

    /**
     * @param registry Registry of the runtimes executing the graph, or {@code null} to control the model only.
     */
    public static RootControlNode createFor(FlowGraph flowGraph, String name, RuntimeRegistry registry) {
        return new RootControlNode("controller_" + UUID.randomUUID(), name, flowGraph, registry, System.currentTimeMillis());
    }

    public static RootControlNode createFor(FlowGraph flowGraph) {
        return createFor(flowGraph, "Controller", null);
    }

    /**
     * Marks all nodes {@code RUNNING} and resumes paused runtimes. Runtimes are started by their owner,
     * not by the controller.
     */
    public FlowGraph startAll() {
        FlowGraph updated = setAllRootNodesState(ExecutionState.RUNNING);
        if (registry != null) {
            registry.resumeAll();
        }
        log.info("{}: started flow '{}'", name, flowGraph.name());
        return updated;
    }

    public FlowGraph pauseAll() {
        FlowGraph updated = setAllRootNodesState(ExecutionState.PAUSED);
        if (registry != null) {
            registry.pauseAll();
        }
        log.info("{}: paused flow '{}'", name, flowGraph.name());
        return updated;
    }

    public FlowGraph resumeAll() {
        FlowGraph updated = setAllRootNodesState(ExecutionState.RUNNING);
        if (registry != null) {
            registry.resumeAll();
        }
        log.info("{}: resumed flow '{}'", name, flowGraph.name());
        return updated;
    }

    public FlowGraph stopAll() {
        FlowGraph updated = setAllRootNodesState(ExecutionState.IDLE);
        if (registry != null) {
            registry.stopAll();
        }
        log.info("{}: stopped flow '{}'", name, flowGraph.name());
        return updated;
    }

    public FlowExecutionStatus getStatus() {
        return FlowExecutionStatus.fromFlowGraph(flowGraph);
    }

    /**
     * Sets the resting state of one node, wherever it is nested, and propagates it to the node's children.
     * Direct calls apply to independently controlled nodes as well.
     *
     * @throws NoSuchElementException if the graph has no such node.
     */
    public FlowGraph setNodeState(String nodeId, ExecutionState newState) {
        requireNode(nodeId);
        return updateNode(nodeId, node -> node.withExecutionState(newState, true));
    }

    /**
     * Replaces the control configuration of one node and propagates it to the node's children.
     *
     * @throws NoSuchElementException if the graph has no such node.
     */
    public FlowGraph setNodeConfig(String nodeId, ControlConfig newConfig) {
        requireNode(nodeId);
        return updateNode(nodeId, node -> node.withControlConfig(newConfig, true));
    }

    public RootControlNode withFlowGraph(FlowGraph newGraph) {
        return new RootControlNode(id, name, newGraph, registry, createdAt);
    }

    private FlowGraph setAllRootNodesState(ExecutionState newState) {
        List<Node> updated = new ArrayList<>();
        for (Node node : flowGraph.rootNodes()) {
            updated.add(node.isIndependent() ? node : node.withExecutionState(newState, true));
        }
        return flowGraph.withNodes(updated);
    }

    private void requireNode(String nodeId) {
        if (flowGraph.findNode(nodeId).isEmpty()) {
            throw new NoSuchElementException("Node with id '" + nodeId + "' not found in flow graph '" + flowGraph.id() + "'");
        }
    }

    private FlowGraph updateNode(String nodeId, UnaryOperator<Node> change) {
        List<Node> updated = new ArrayList<>();
        for (Node root : flowGraph.rootNodes()) {
            updated.add(updateRecursive(root, nodeId, change));
        }
        return flowGraph.withNodes(updated);
    }

    private static Node updateRecursive(Node node, String targetId, UnaryOperator<Node> change) {
        if (node.id().equals(targetId)) {
            return change.apply(node);
        }
        if (node instanceof GraphNode graphNode) {
            List<Node> children = new ArrayList<>();
            for (Node child : graphNode.childNodes()) {
                children.add(updateRecursive(child, targetId, change));
            }
            return graphNode.withChildren(children);
        }
        return node;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public FlowGraph getFlowGraph() {
        return flowGraph;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
