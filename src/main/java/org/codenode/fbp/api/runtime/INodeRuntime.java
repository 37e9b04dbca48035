package org.codenode.fbp.api.runtime;

import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.ExecutionState;

/**
 * The data-type independent lifecycle contract of a live node.
 * <p>
 * State machine: {@code IDLE -(start)-> RUNNING -(pause)-> PAUSED -(resume)-> RUNNING},
 * {@code RUNNING|PAUSED|ERROR -(stop)-> IDLE}. A failing processing function moves the runtime to
 * {@code ERROR}. Transitions that do not apply to the current state are silent no-ops so that bulk
 * operations over mixed states never fail.
 */
public interface INodeRuntime {

    /**
     * @return The id of the node this runtime executes.
     */
    String getNodeId();

    /**
     * @return The model node this runtime was created for.
     */
    CodeNode getCodeNode();

    /**
     * @return The live state, which is independent of the model node's resting state.
     */
    ExecutionState getExecutionState();

    /**
     * Moves to {@code IDLE}, cancels the running task and unregisters the runtime.
     * No-op if already idle.
     */
    void stop();

    /**
     * Moves from {@code RUNNING} to {@code PAUSED}. No-op in any other state.
     */
    void pause();

    /**
     * Moves from {@code PAUSED} to {@code RUNNING}. No-op in any other state.
     */
    void resume();

    default boolean isRunning() {
        return getExecutionState() == ExecutionState.RUNNING;
    }

    default boolean isPaused() {
        return getExecutionState() == ExecutionState.PAUSED;
    }

    default boolean isIdle() {
        return getExecutionState() == ExecutionState.IDLE;
    }

    /**
     * @return {@code true} if bulk operations must skip this runtime.
     */
    default boolean isIndependentlyControlled() {
        return getCodeNode().controlConfig().independentControl();
    }
}
