package org.codenode.fbp.model;

/**
 * Snapshot of the resting execution states across every node of a {@link FlowGraph}.
 * <p>
 * {@code overallState} is derived by priority: any ERROR, else any RUNNING, else any PAUSED, else IDLE.
 */
public record FlowExecutionStatus(int totalNodes,
                                  int idleCount,
                                  int runningCount,
                                  int pausedCount,
                                  int errorCount,
                                  int independentControlCount,
                                  ExecutionState overallState) {

    public static FlowExecutionStatus fromFlowGraph(FlowGraph flowGraph) {
        int idle = 0;
        int running = 0;
        int paused = 0;
        int error = 0;
        int independent = 0;
        int total = 0;
        for (Node node : flowGraph.getAllNodes()) {
            total++;
            switch (node.executionState()) {
                case IDLE -> idle++;
                case RUNNING -> running++;
                case PAUSED -> paused++;
                case ERROR -> error++;
            }
            if (node.isIndependent()) {
                independent++;
            }
        }
        ExecutionState overall;
        if (error > 0) {
            overall = ExecutionState.ERROR;
        } else if (running > 0) {
            overall = ExecutionState.RUNNING;
        } else if (paused > 0) {
            overall = ExecutionState.PAUSED;
        } else {
            overall = ExecutionState.IDLE;
        }
        return new FlowExecutionStatus(total, idle, running, paused, error, independent, overall);
    }
}
