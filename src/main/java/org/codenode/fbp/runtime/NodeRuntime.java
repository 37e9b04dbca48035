package org.codenode.fbp.runtime;

import org.codenode.fbp.api.channels.ChannelClosedException;
import org.codenode.fbp.api.runtime.IMonitorable;
import org.codenode.fbp.api.runtime.INodeRuntime;
import org.codenode.fbp.api.runtime.OperationalError;
import org.codenode.fbp.model.CodeNode;
import org.codenode.fbp.model.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The live, scheduled execution wrapper around a node's processing logic.
 * <p>
 * This class implements the state machine only and knows nothing about data types or channels.
 * Each {@link #start(ExecutorService, ProcessingBlock)} submits exactly one task to the caller's
 * executor; the task runs the processing block until it returns, fails or is cancelled by
 * {@link #stop()}.
 * <p>
 * <strong>Exit handling:</strong>
 * <ul>
 *   <li>Normal return, {@link ChannelClosedException} or interruption: the runtime becomes {@code IDLE}.</li>
 *   <li>Any other exception: the runtime becomes {@code ERROR} and records a
 *       {@code PROCESSING_FAILED} {@link OperationalError}. The stack trace is logged at DEBUG only.</li>
 * </ul>
 * In every case the runtime leaves its registry and {@link #onTerminated()} runs exactly once per start.
 * <p>
 * Subclasses with a processing loop must call {@link #awaitRunnable()} at the top of every cycle.
 */
public class NodeRuntime implements INodeRuntime, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final RuntimeSettings settings;
    private final CodeNode codeNode;
    private final RuntimeRegistry registry;
    private final AtomicReference<ExecutionState> state = new AtomicReference<>(ExecutionState.IDLE);
    private final Object pauseLock = new Object();
    private final Object lifecycleLock = new Object();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private volatile Future<?> task;
    private final ThreadLocal<Long> taskGeneration = new ThreadLocal<>();

    // Written under lifecycleLock. Each start opens a new generation, finish() closes it once.
    private volatile long generation;
    private long finishedGeneration;

    /**
     * @param codeNode The node to execute. Its control configuration decides whether bulk
     *                 operations reach this runtime.
     * @param registry Registry to join while running, or {@code null}.
     * @param settings Runtime tunables.
     */
    public NodeRuntime(CodeNode codeNode, RuntimeRegistry registry, RuntimeSettings settings) {
        this.codeNode = Objects.requireNonNull(codeNode, "codeNode");
        this.registry = registry;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public NodeRuntime(CodeNode codeNode, RuntimeRegistry registry) {
        this(codeNode, registry, RuntimeSettings.defaults());
    }

    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * Starts the processing block on the given executor.
     * <p>
     * A task left over from a previous start is cancelled first, so calling this twice never
     * leaves two tasks running for one node. Starting from {@code ERROR} is allowed and acts as a restart.
     *
     * @param scheduler       Executor that runs the task. It is not shut down by this runtime.
     * @param processingBlock The work to run.
     * @throws RejectedExecutionException if the executor refuses the task. The runtime is left {@code IDLE}.
     */
    public void start(ExecutorService scheduler, ProcessingBlock processingBlock) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(processingBlock, "processingBlock");
        synchronized (lifecycleLock) {
            Future<?> previous = task;
            task = null;
            if (previous != null) {
                previous.cancel(true);
            }
            finish(generation);

            long gen = ++generation;
            onStarting();
            if (registry != null) {
                registry.register(this);
            }
            state.set(ExecutionState.RUNNING);
            try {
                task = scheduler.submit(() -> runProcessing(gen, processingBlock));
            } catch (RejectedExecutionException e) {
                state.set(ExecutionState.IDLE);
                finish(gen);
                throw e;
            }
        }
        logStarted();
    }

    /**
     * Logs the start of the runtime. Subclasses may override this to add detail.
     */
    protected void logStarted() {
        log.info("{} started", getDisplayName());
    }

    @Override
    public void stop() {
        Future<?> running;
        long gen;
        synchronized (lifecycleLock) {
            ExecutionState previous = state.getAndSet(ExecutionState.IDLE);
            running = task;
            task = null;
            gen = generation;
            if (previous == ExecutionState.IDLE && running == null) {
                return;
            }
        }
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
        if (running != null) {
            running.cancel(true);
        }
        synchronized (lifecycleLock) {
            finish(gen);
        }
        log.info("{} stopped", getDisplayName());
    }

    @Override
    public void pause() {
        if (state.compareAndSet(ExecutionState.RUNNING, ExecutionState.PAUSED)) {
            log.info("{} paused", getDisplayName());
        }
    }

    @Override
    public void resume() {
        if (state.compareAndSet(ExecutionState.PAUSED, ExecutionState.RUNNING)) {
            log.info("{} resumed", getDisplayName());
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
    }

    @Override
    public ExecutionState getExecutionState() {
        return state.get();
    }

    @Override
    public String getNodeId() {
        return codeNode.id();
    }

    @Override
    public CodeNode getCodeNode() {
        return codeNode;
    }

    protected String getDisplayName() {
        return codeNode.name();
    }

    /**
     * Blocks while the runtime is paused.
     * <p>
     * The wait is woken by {@link #resume()} and {@link #stop()}, and re-checks the state at least every
     * {@link RuntimeSettings#pausePollInterval()}.
     *
     * @return {@code true} if the loop should run another cycle, {@code false} if the runtime is no
     * longer running or a later start has replaced the calling task.
     * @throws InterruptedException if the task is cancelled while waiting.
     */
    protected boolean awaitRunnable() throws InterruptedException {
        boolean waited = false;
        synchronized (pauseLock) {
            while (state.get() == ExecutionState.PAUSED && isCurrentRun()) {
                if (!waited) {
                    log.debug("{} is paused, waiting...", getDisplayName());
                    waited = true;
                }
                pauseLock.wait(settings.pausePollMillis());
            }
        }
        if (!isCurrentRun()) {
            log.debug("{} left a superseded processing task", getDisplayName());
            return false;
        }
        if (waited) {
            onResumedFromPause();
        }
        return state.get() == ExecutionState.RUNNING;
    }

    /**
     * @return {@code false} on a task thread whose start has been replaced by a later start, which
     * happens when a restarted task ignored its cancellation. {@code true} on any other thread.
     */
    protected final boolean isCurrentRun() {
        Long gen = taskGeneration.get();
        return gen == null || gen == generation;
    }

    /**
     * Called under the lifecycle lock before the task of a new start is submitted.
     */
    protected void onStarting() {
        // Default: nothing to prepare
    }

    /**
     * Called once after each run ends, whether by stop, completion or failure.
     */
    protected void onTerminated() {
        // Default: nothing to release
    }

    /**
     * Called on the task's thread after it left a pause.
     */
    protected void onResumedFromPause() {
        // Default: nothing to resynchronize
    }

    private void runProcessing(long gen, ProcessingBlock processingBlock) {
        taskGeneration.set(gen);
        try {
            processingBlock.run();
        } catch (InterruptedException e) {
            log.debug("{} interrupted, shutting down.", getDisplayName());
            Thread.currentThread().interrupt();
        } catch (ChannelClosedException e) {
            log.debug("{} reached end of stream: {}", getDisplayName(), e.getMessage());
        } catch (Exception e) {
            fail(gen, e);
        } finally {
            synchronized (lifecycleLock) {
                if (gen == generation) {
                    state.compareAndSet(ExecutionState.RUNNING, ExecutionState.IDLE);
                    state.compareAndSet(ExecutionState.PAUSED, ExecutionState.IDLE);
                    task = null;
                }
                finish(gen);
            }
            taskGeneration.remove();
            log.debug("Processing task of {} has terminated.", getDisplayName());
        }
    }

    private void fail(long gen, Exception e) {
        boolean current;
        synchronized (lifecycleLock) {
            current = gen == generation
                && (state.compareAndSet(ExecutionState.RUNNING, ExecutionState.ERROR)
                    || state.compareAndSet(ExecutionState.PAUSED, ExecutionState.ERROR));
        }
        if (!current) {
            log.debug("{} failed after it was stopped: {}", getDisplayName(), e.toString());
            return;
        }
        log.error("{} stopped with ERROR due to {}: {}", getDisplayName(), e.getClass().getSimpleName(), e.getMessage());
        log.debug("Exception details:", e);
        recordError("PROCESSING_FAILED", "Processing function of node '" + getNodeId() + "' failed",
            e.getClass().getName() + ": " + e.getMessage());
    }

    // Caller holds lifecycleLock.
    private void finish(long gen) {
        if (gen <= finishedGeneration) {
            return;
        }
        finishedGeneration = gen;
        if (registry != null) {
            registry.unregister(this);
        }
        onTerminated();
    }

    /**
     * Records an operational error for monitoring. The collection is bounded by {@link #getMaxErrors()}.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return state.get() != ExecutionState.ERROR && errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add their own metrics. Call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map that already holds the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getNodeId() + ", " + state.get() + "]";
    }
}
