package org.codenode.fbp.model;

/**
 * The execution lifecycle state of a node.
 * <p>
 * The same enum is used for the resting value stored on a model node and for the live value owned by a
 * running {@code NodeRuntime}. The two are never synchronized automatically.
 */
public enum ExecutionState {
    /**
     * The node is not processing and can be started.
     */
    IDLE,
    /**
     * The node is actively processing.
     */
    RUNNING,
    /**
     * The node is suspended and can be resumed without losing queued input.
     */
    PAUSED,
    /**
     * The node's processing function failed. Left by stopping or restarting the node.
     */
    ERROR
}
