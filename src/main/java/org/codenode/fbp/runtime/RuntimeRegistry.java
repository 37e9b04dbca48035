package org.codenode.fbp.runtime;

import org.codenode.fbp.api.runtime.INodeRuntime;
import org.codenode.fbp.model.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The live index of running node runtimes, keyed by node id.
 * <p>
 * Runtimes join and leave the registry on their own as they start and terminate. Bulk operations
 * iterate a snapshot taken under the lock and call the runtimes outside of it, so runtimes may
 * register or unregister concurrently. Runtimes whose node has {@code independentControl} set are
 * skipped by all bulk operations.
 * <p>
 * Create one registry per executing flow graph.
 */
public class RuntimeRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuntimeRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, INodeRuntime> runtimes = new LinkedHashMap<>();

    void register(INodeRuntime runtime) {
        lock.lock();
        try {
            INodeRuntime previous = runtimes.put(runtime.getNodeId(), runtime);
            if (previous != null && previous != runtime) {
                log.warn("Runtime for node '{}' replaced a different runtime with the same node id", runtime.getNodeId());
            }
        } finally {
            lock.unlock();
        }
    }

    void unregister(INodeRuntime runtime) {
        lock.lock();
        try {
            runtimes.remove(runtime.getNodeId(), runtime);
        } finally {
            lock.unlock();
        }
    }

    public void pauseAll() {
        int affected = forEachControlled(INodeRuntime::pause);
        log.debug("Paused {} runtimes", affected);
    }

    public void resumeAll() {
        int affected = forEachControlled(INodeRuntime::resume);
        log.debug("Resumed {} runtimes", affected);
    }

    /**
     * Stops every runtime that is not independently controlled, then empties the registry.
     * Independent runtimes keep running but are no longer tracked.
     */
    public void stopAll() {
        int affected = forEachControlled(INodeRuntime::stop);
        clear();
        log.debug("Stopped {} runtimes", affected);
    }

    private int forEachControlled(Consumer<INodeRuntime> action) {
        int affected = 0;
        for (INodeRuntime runtime : snapshot()) {
            if (runtime.isIndependentlyControlled()) {
                log.debug("Skipping independently controlled node '{}'", runtime.getNodeId());
                continue;
            }
            try {
                action.accept(runtime);
                affected++;
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.warn("Could not perform action on node '{}': {}", runtime.getNodeId(), e.getMessage());
            }
        }
        return affected;
    }

    /**
     * @return The registered runtimes in registration order, copied under the lock.
     */
    public List<INodeRuntime> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(runtimes.values());
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return runtimes.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String nodeId) {
        lock.lock();
        try {
            return runtimes.containsKey(nodeId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<INodeRuntime> get(String nodeId) {
        lock.lock();
        try {
            return Optional.ofNullable(runtimes.get(nodeId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets all runtimes without touching their state.
     */
    public void clear() {
        lock.lock();
        try {
            runtimes.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The live state of every registered runtime, keyed by node id.
     */
    public Map<String, ExecutionState> getStates() {
        Map<String, ExecutionState> states = new LinkedHashMap<>();
        for (INodeRuntime runtime : snapshot()) {
            states.put(runtime.getNodeId(), runtime.getExecutionState());
        }
        return states;
    }
}
